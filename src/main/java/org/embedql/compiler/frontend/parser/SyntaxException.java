package org.embedql.compiler.frontend.parser;

import org.embedql.compiler.api.SourceInfo;

/**
 * Raised by the lexer or the parser when query-language text is not well formed.
 * The message has the form {@code Syntax Error: <detail>} followed by the location.
 */
public class SyntaxException extends RuntimeException {

    private final SourceInfo location;

    /**
     * @param detail   What was wrong, e.g. {@code Expected Name, found "}"}.
     * @param location Where the problem was found, in host-file coordinates.
     */
    public SyntaxException(String detail, SourceInfo location) {
        super("Syntax Error: " + detail + " (" + location + ")");
        this.location = location;
    }

    public SourceInfo location() {
        return location;
    }
}
