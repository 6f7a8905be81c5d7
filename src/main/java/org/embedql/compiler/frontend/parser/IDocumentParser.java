package org.embedql.compiler.frontend.parser;

import org.embedql.compiler.frontend.parser.ast.Document;

/**
 * The grammar parser collaborator: turns query-language text into a syntax tree.
 * <p>
 * The source module parser treats implementations as opaque. It never changes the error
 * format of a {@link SyntaxException}; it only attaches file-level context when re-raising.
 */
@FunctionalInterface
public interface IDocumentParser {

    /**
     * Parses a complete document.
     *
     * @param source The text and its origin.
     * @return The document; empty text yields a document without definitions.
     * @throws SyntaxException If the text is not well formed.
     */
    Document parse(Source source);
}
