package org.embedql.compiler.frontend.parser;

import org.embedql.compiler.frontend.lexer.Lexer;
import org.embedql.compiler.frontend.lexer.Token;
import org.embedql.compiler.frontend.lexer.TokenType;
import org.embedql.compiler.frontend.parser.ast.Argument;
import org.embedql.compiler.frontend.parser.ast.Definition;
import org.embedql.compiler.frontend.parser.ast.DefinitionKind;
import org.embedql.compiler.frontend.parser.ast.Directive;
import org.embedql.compiler.frontend.parser.ast.Document;
import org.embedql.compiler.frontend.parser.ast.Field;
import org.embedql.compiler.frontend.parser.ast.FragmentDefinition;
import org.embedql.compiler.frontend.parser.ast.FragmentSpread;
import org.embedql.compiler.frontend.parser.ast.InlineFragment;
import org.embedql.compiler.frontend.parser.ast.OperationDefinition;
import org.embedql.compiler.frontend.parser.ast.Selection;
import org.embedql.compiler.frontend.parser.ast.SelectionSet;
import org.embedql.compiler.frontend.parser.ast.Value;
import org.embedql.compiler.frontend.parser.ast.VariableDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the executable subset of the query language: operations,
 * the anonymous query shorthand and fragments.
 * <p>
 * Instances are stateless and thread-safe; every call to {@link #parse(Source)} works on its
 * own token cursor.
 */
public class QueryDocumentParser implements IDocumentParser {

    @Override
    public Document parse(Source source) {
        List<Token> tokens = new Lexer(source).scanTokens();
        return new Cursor(tokens).document();
    }

    /**
     * Token cursor for a single parse.
     */
    private static final class Cursor {

        private final List<Token> tokens;
        private int current = 0;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Document document() {
            List<Definition> definitions = new ArrayList<>();
            while (!isAtEnd()) {
                definitions.add(definition());
            }
            return new Document(definitions);
        }

        private Definition definition() {
            Token token = peek();
            if (check(TokenType.BRACE_L)) {
                return new OperationDefinition(DefinitionKind.QUERY, null, List.of(), List.of(),
                        selectionSet(), token.location());
            }
            if (check(TokenType.NAME)) {
                if ("fragment".equals(token.text())) {
                    return fragmentDefinition();
                }
                DefinitionKind kind = DefinitionKind.forOperationKeyword(token.text());
                if (kind != null) {
                    return operationDefinition(kind);
                }
            }
            throw unexpected(token);
        }

        private OperationDefinition operationDefinition(DefinitionKind kind) {
            Token start = advance();
            String name = check(TokenType.NAME) ? advance().text() : null;
            List<VariableDefinition> variables = variableDefinitions();
            List<Directive> directives = directives(false);
            SelectionSet selectionSet = selectionSet();
            return new OperationDefinition(kind, name, variables, directives, selectionSet, start.location());
        }

        private FragmentDefinition fragmentDefinition() {
            Token start = advance();
            Token name = consume(TokenType.NAME);
            if ("on".equals(name.text())) {
                throw unexpected(name);
            }
            expectKeyword("on");
            String typeCondition = consume(TokenType.NAME).text();
            List<Directive> directives = directives(false);
            SelectionSet selectionSet = selectionSet();
            return new FragmentDefinition(name.text(), typeCondition, directives, selectionSet, start.location());
        }

        private List<VariableDefinition> variableDefinitions() {
            List<VariableDefinition> variables = new ArrayList<>();
            if (!match(TokenType.PAREN_L)) {
                return variables;
            }
            do {
                consume(TokenType.DOLLAR);
                String name = consume(TokenType.NAME).text();
                consume(TokenType.COLON);
                String type = typeReference();
                Value defaultValue = match(TokenType.EQUALS) ? value(true) : null;
                directives(true);
                variables.add(new VariableDefinition(name, type, defaultValue));
            } while (!match(TokenType.PAREN_R));
            return variables;
        }

        private String typeReference() {
            String type;
            if (match(TokenType.BRACKET_L)) {
                String inner = typeReference();
                consume(TokenType.BRACKET_R);
                type = "[" + inner + "]";
            } else {
                type = consume(TokenType.NAME).text();
            }
            if (match(TokenType.BANG)) {
                type += "!";
            }
            return type;
        }

        private SelectionSet selectionSet() {
            consume(TokenType.BRACE_L);
            List<Selection> selections = new ArrayList<>();
            do {
                selections.add(selection());
            } while (!match(TokenType.BRACE_R));
            return new SelectionSet(selections);
        }

        private Selection selection() {
            if (check(TokenType.SPREAD)) {
                return fragment();
            }
            return field();
        }

        private Field field() {
            Token start = peek();
            String nameOrAlias = consume(TokenType.NAME).text();
            String alias = null;
            String name = nameOrAlias;
            if (match(TokenType.COLON)) {
                alias = nameOrAlias;
                name = consume(TokenType.NAME).text();
            }
            List<Argument> arguments = arguments(false);
            List<Directive> directives = directives(false);
            SelectionSet selectionSet = check(TokenType.BRACE_L) ? selectionSet() : null;
            return new Field(alias, name, arguments, directives, selectionSet, start.location());
        }

        private Selection fragment() {
            Token start = consume(TokenType.SPREAD);
            boolean hasTypeCondition = check(TokenType.NAME) && "on".equals(peek().text());
            if (!hasTypeCondition && check(TokenType.NAME)) {
                String name = advance().text();
                return new FragmentSpread(name, directives(false), start.location());
            }
            String typeCondition = null;
            if (hasTypeCondition) {
                advance();
                typeCondition = consume(TokenType.NAME).text();
            }
            List<Directive> directives = directives(false);
            return new InlineFragment(typeCondition, directives, selectionSet(), start.location());
        }

        private List<Argument> arguments(boolean isConst) {
            List<Argument> arguments = new ArrayList<>();
            if (!match(TokenType.PAREN_L)) {
                return arguments;
            }
            do {
                String name = consume(TokenType.NAME).text();
                consume(TokenType.COLON);
                arguments.add(new Argument(name, value(isConst)));
            } while (!match(TokenType.PAREN_R));
            return arguments;
        }

        private List<Directive> directives(boolean isConst) {
            List<Directive> directives = new ArrayList<>();
            while (match(TokenType.AT)) {
                String name = consume(TokenType.NAME).text();
                directives.add(new Directive(name, arguments(isConst)));
            }
            return directives;
        }

        private Value value(boolean isConst) {
            Token token = peek();
            switch (token.type()) {
                case BRACKET_L -> {
                    advance();
                    List<String> items = new ArrayList<>();
                    while (!match(TokenType.BRACKET_R)) {
                        items.add(value(isConst).text());
                    }
                    return new Value(Value.Kind.LIST, "[" + String.join(", ", items) + "]");
                }
                case BRACE_L -> {
                    advance();
                    List<String> fields = new ArrayList<>();
                    while (!match(TokenType.BRACE_R)) {
                        String name = consume(TokenType.NAME).text();
                        consume(TokenType.COLON);
                        fields.add(name + ": " + value(isConst).text());
                    }
                    return new Value(Value.Kind.OBJECT, "{" + String.join(", ", fields) + "}");
                }
                case INT -> {
                    return new Value(Value.Kind.INT, advance().text());
                }
                case FLOAT -> {
                    return new Value(Value.Kind.FLOAT, advance().text());
                }
                case STRING, BLOCK_STRING -> {
                    return new Value(Value.Kind.STRING, advance().text());
                }
                case NAME -> {
                    String text = advance().text();
                    if ("true".equals(text) || "false".equals(text)) {
                        return new Value(Value.Kind.BOOLEAN, text);
                    }
                    if ("null".equals(text)) {
                        return new Value(Value.Kind.NULL, text);
                    }
                    return new Value(Value.Kind.ENUM, text);
                }
                case DOLLAR -> {
                    if (!isConst) {
                        advance();
                        return new Value(Value.Kind.VARIABLE, "$" + consume(TokenType.NAME).text());
                    }
                    throw unexpected(token);
                }
                default -> throw unexpected(token);
            }
        }

        private void expectKeyword(String keyword) {
            Token token = peek();
            if (token.type() == TokenType.NAME && keyword.equals(token.text())) {
                advance();
                return;
            }
            throw new SyntaxException("Expected \"" + keyword + "\", found " + token.describe() + ".", token.location());
        }

        private Token consume(TokenType type) {
            Token token = peek();
            if (token.type() == type) {
                return advance();
            }
            throw new SyntaxException("Expected " + type.description() + ", found " + token.describe() + ".",
                    token.location());
        }

        private SyntaxException unexpected(Token token) {
            return new SyntaxException("Unexpected " + token.describe() + ".", token.location());
        }

        private boolean match(TokenType type) {
            if (check(type)) {
                advance();
                return true;
            }
            return false;
        }

        private boolean check(TokenType type) {
            return peek().type() == type;
        }

        private Token advance() {
            Token token = tokens.get(current);
            if (!isAtEnd()) {
                current++;
            }
            return token;
        }

        private Token peek() {
            return tokens.get(current);
        }

        private boolean isAtEnd() {
            return peek().type() == TokenType.EOF;
        }
    }
}
