package org.embedql.compiler.frontend.lexer;

import org.embedql.compiler.api.SourceInfo;

/**
 * A single lexical token.
 *
 * @param type     The token kind.
 * @param text     The raw lexeme as written in the source (strings keep their quotes).
 * @param location The position of the first character, in host-file coordinates.
 */
public record Token(TokenType type, String text, SourceInfo location) {

    public String fileName() {
        return location.fileName();
    }

    public int line() {
        return location.lineNumber();
    }

    /**
     * @return The token as shown in syntax error messages.
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return type.description();
        }
        if (type == TokenType.NAME || type == TokenType.INT || type == TokenType.FLOAT) {
            return type.description() + " \"" + text + "\"";
        }
        if (type == TokenType.STRING || type == TokenType.BLOCK_STRING) {
            return type.description() + " " + text;
        }
        return "\"" + text + "\"";
    }
}
