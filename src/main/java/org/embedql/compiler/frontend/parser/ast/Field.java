package org.embedql.compiler.frontend.parser.ast;

import org.embedql.compiler.api.SourceInfo;

import java.util.List;

/**
 * A field selection.
 *
 * @param alias        The response key alias, or {@code null}.
 * @param name         The field name.
 * @param arguments    Field arguments.
 * @param directives   Directives applied to the field.
 * @param selectionSet Nested selections, or {@code null} for a leaf field.
 * @param location     Position of the first token.
 */
public record Field(
        String alias,
        String name,
        List<Argument> arguments,
        List<Directive> directives,
        SelectionSet selectionSet,
        SourceInfo location
) implements Selection {

    public Field {
        arguments = List.copyOf(arguments);
        directives = List.copyOf(directives);
    }

    /**
     * @return The key under which the field appears in a response.
     */
    public String responseKey() {
        return alias != null ? alias : name;
    }
}
