package org.embedql.compiler.frontend.parser.ast;

/**
 * An input value. Values are kept in printed form; list and object values are printed
 * with normalized spacing, e.g. {@code [1, 2]} or {@code {a: 1}}.
 *
 * @param kind The value kind.
 * @param text The printed value.
 */
public record Value(Kind kind, String text) implements AstNode {

    public enum Kind {
        VARIABLE,
        INT,
        FLOAT,
        STRING,
        BOOLEAN,
        NULL,
        ENUM,
        LIST,
        OBJECT
    }
}
