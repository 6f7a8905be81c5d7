package org.embedql.compiler.frontend.parser.ast;

/**
 * Marker interface for all nodes of the query-language syntax tree.
 */
public interface AstNode {
}
