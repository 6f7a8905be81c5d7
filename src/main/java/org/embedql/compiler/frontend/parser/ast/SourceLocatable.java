package org.embedql.compiler.frontend.parser.ast;

import org.embedql.compiler.api.SourceInfo;

/**
 * Capability interface for AST nodes that know where they were written.
 * Used to attribute diagnostics to the host file the node was extracted from.
 *
 * <p>Not every node carries a location (e.g. argument values); only nodes that are
 * reported on by later phases implement this interface.
 */
public interface SourceLocatable {

    /**
     * @return The position of the node's first token, in host-file coordinates.
     */
    SourceInfo location();

    /**
     * @return The path of the file this node originated from.
     */
    default String getSourceFileName() {
        return location().fileName();
    }
}
