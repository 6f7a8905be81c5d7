package org.embedql.compiler.frontend.parser.ast;

import org.embedql.compiler.api.SourceInfo;

import java.util.List;

/**
 * A named fragment on a type.
 *
 * @param name          The fragment name.
 * @param typeCondition The type the fragment applies to.
 * @param directives    Directives applied to the fragment.
 * @param selectionSet  The fragment's selections.
 * @param location      Position of the {@code fragment} keyword.
 */
public record FragmentDefinition(
        String name,
        String typeCondition,
        List<Directive> directives,
        SelectionSet selectionSet,
        SourceInfo location
) implements Definition {

    public FragmentDefinition {
        directives = List.copyOf(directives);
    }

    @Override
    public DefinitionKind kind() {
        return DefinitionKind.FRAGMENT;
    }
}
