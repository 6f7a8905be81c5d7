package org.embedql.compiler.frontend.parser.ast;

import org.embedql.compiler.api.SourceInfo;

import java.util.List;

/**
 * A query, mutation or subscription.
 *
 * @param kind                The operation kind (never {@link DefinitionKind#FRAGMENT}).
 * @param name                The operation name, or {@code null} when anonymous.
 * @param variableDefinitions Declared variables.
 * @param directives          Directives applied to the operation.
 * @param selectionSet        The top-level selections.
 * @param location            Position of the first token.
 */
public record OperationDefinition(
        DefinitionKind kind,
        String name,
        List<VariableDefinition> variableDefinitions,
        List<Directive> directives,
        SelectionSet selectionSet,
        SourceInfo location
) implements Definition {

    public OperationDefinition {
        if (!kind.isOperation()) {
            throw new IllegalArgumentException("Not an operation kind: " + kind);
        }
        variableDefinitions = List.copyOf(variableDefinitions);
        directives = List.copyOf(directives);
    }
}
