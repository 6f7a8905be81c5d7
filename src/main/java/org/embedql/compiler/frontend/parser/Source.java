package org.embedql.compiler.frontend.parser;

import org.embedql.compiler.api.SourceInfo;

import java.util.Objects;

/**
 * Query-language text together with its origin. The location offset records where the text
 * starts inside its host file, so that positions reported by the lexer and parser point into
 * the host file instead of into the extracted literal.
 *
 * @param body         The query-language text.
 * @param name         The originating file path (used in error messages).
 * @param lineOffset   The 1-based host line on which {@code body} starts.
 * @param columnOffset The 1-based host column at which {@code body} starts.
 */
public record Source(String body, String name, int lineOffset, int columnOffset) {

    public Source {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(name, "name");
        if (lineOffset < 1 || columnOffset < 1) {
            throw new IllegalArgumentException("Location offsets are 1-based, got " + lineOffset + ":" + columnOffset);
        }
    }

    /**
     * Creates a source that starts at the beginning of its file.
     */
    public static Source of(String body, String name) {
        return new Source(body, name, 1, 1);
    }

    /**
     * Translates a position inside {@link #body()} into host-file coordinates.
     * Only the first line of the body is shifted horizontally.
     *
     * @param line   1-based line inside the body.
     * @param column 1-based column inside the body.
     * @return The position in the host file.
     */
    public SourceInfo locate(int line, int column) {
        int hostLine = lineOffset + line - 1;
        int hostColumn = line == 1 ? columnOffset + column - 1 : column;
        return new SourceInfo(name, hostLine, hostColumn);
    }
}
