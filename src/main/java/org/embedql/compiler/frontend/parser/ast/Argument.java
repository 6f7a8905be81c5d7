package org.embedql.compiler.frontend.parser.ast;

/**
 * A {@code name: value} pair of a field or directive.
 */
public record Argument(String name, Value value) implements AstNode {
}
