package org.embedql.compiler.frontend.parser.ast;

import org.embedql.compiler.api.SourceInfo;

import java.util.List;

/**
 * A {@code ...FragmentName} spread.
 */
public record FragmentSpread(String name, List<Directive> directives, SourceInfo location) implements Selection {

    public FragmentSpread {
        directives = List.copyOf(directives);
    }
}
