package org.embedql.compiler.frontend.module;

import org.embedql.compiler.frontend.parser.ast.Document;

import java.util.List;

/**
 * The combined document of one file together with the literal texts it was parsed from.
 *
 * @param document The definitions of all literals, in extraction order.
 * @param sources  The literal texts, one per literal, in extraction order.
 */
public record ParsedModule(Document document, List<String> sources) {

    public ParsedModule {
        sources = List.copyOf(sources);
    }
}
