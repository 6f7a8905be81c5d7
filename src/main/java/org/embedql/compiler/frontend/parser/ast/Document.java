package org.embedql.compiler.frontend.parser.ast;

import java.util.List;

/**
 * Root of a syntax tree: the ordered definitions of one parsed text. The source module parser
 * also uses this type for the combined document of a file, concatenating the definitions of
 * all its literals in extraction order.
 *
 * @param definitions The definitions in source order.
 */
public record Document(List<Definition> definitions) implements AstNode {

    public Document {
        definitions = List.copyOf(definitions);
    }

    /**
     * @return The names of all named definitions, in order.
     */
    public List<String> definitionNames() {
        return definitions.stream()
                .map(Definition::name)
                .filter(name -> name != null)
                .toList();
    }
}
