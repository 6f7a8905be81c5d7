package org.embedql.compiler.frontend.parser.ast;

/**
 * A variable declared by an operation.
 *
 * @param name         The variable name without the leading {@code $}.
 * @param type         The declared type as written, e.g. {@code [ID!]!}.
 * @param defaultValue The default value, or {@code null}.
 */
public record VariableDefinition(String name, String type, Value defaultValue) implements AstNode {
}
