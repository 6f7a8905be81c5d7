package org.embedql.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An {@code @name(args)} annotation.
 */
public record Directive(String name, List<Argument> arguments) implements AstNode {

    public Directive {
        arguments = List.copyOf(arguments);
    }
}
