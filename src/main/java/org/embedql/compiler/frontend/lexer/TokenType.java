package org.embedql.compiler.frontend.lexer;

/**
 * Token kinds of the query language.
 */
public enum TokenType {
    BANG("!"),
    DOLLAR("$"),
    AMP("&"),
    PAREN_L("("),
    PAREN_R(")"),
    SPREAD("..."),
    COLON(":"),
    EQUALS("="),
    AT("@"),
    BRACKET_L("["),
    BRACKET_R("]"),
    BRACE_L("{"),
    PIPE("|"),
    BRACE_R("}"),
    NAME("Name"),
    INT("Int"),
    FLOAT("Float"),
    STRING("String"),
    BLOCK_STRING("BlockString"),
    EOF("<EOF>");

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    /**
     * @return The display form used in syntax error messages.
     */
    public String description() {
        return description;
    }
}
