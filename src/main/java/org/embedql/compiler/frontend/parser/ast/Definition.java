package org.embedql.compiler.frontend.parser.ast;

/**
 * A named unit of a document: an operation or a fragment.
 */
public interface Definition extends AstNode, SourceLocatable {

    /**
     * @return The definition's name, or {@code null} for an anonymous operation.
     */
    String name();

    DefinitionKind kind();

    SelectionSet selectionSet();
}
