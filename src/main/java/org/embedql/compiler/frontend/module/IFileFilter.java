package org.embedql.compiler.frontend.module;

import org.embedql.compiler.api.SourceFile;

import java.io.IOException;

/**
 * Cheap membership test deciding whether a file is a parsing candidate at all.
 * Used by the watch/build layer before files are handed to the source module parser.
 */
@FunctionalInterface
public interface IFileFilter {

    /**
     * @param file The file to test.
     * @return {@code true} if the file may contain embedded literals.
     * @throws IOException If the file cannot be read.
     */
    boolean accept(SourceFile file) throws IOException;
}
