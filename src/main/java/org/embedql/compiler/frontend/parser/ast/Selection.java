package org.embedql.compiler.frontend.parser.ast;

/**
 * One entry of a selection set: a field, a fragment spread or an inline fragment.
 */
public interface Selection extends AstNode, SourceLocatable {
}
