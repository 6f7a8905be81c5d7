package org.embedql.compiler.frontend.parser.ast;

import org.embedql.compiler.api.SourceInfo;

import java.util.List;

/**
 * An inline fragment {@code ... on Type { ... }}; the type condition is optional.
 */
public record InlineFragment(
        String typeCondition,
        List<Directive> directives,
        SelectionSet selectionSet,
        SourceInfo location
) implements Selection {

    public InlineFragment {
        directives = List.copyOf(directives);
    }
}
