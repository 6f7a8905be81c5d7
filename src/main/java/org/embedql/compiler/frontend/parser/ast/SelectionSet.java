package org.embedql.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The braces-delimited list of selections of an operation, fragment or field.
 */
public record SelectionSet(List<Selection> selections) implements AstNode {

    public SelectionSet {
        selections = List.copyOf(selections);
    }
}
