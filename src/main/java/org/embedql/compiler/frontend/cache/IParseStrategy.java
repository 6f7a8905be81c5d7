package org.embedql.compiler.frontend.cache;

import org.embedql.compiler.api.SourceFile;
import org.embedql.compiler.frontend.parser.ast.Document;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Produces the document of a file on a cache miss.
 * {@link org.embedql.compiler.frontend.module.SourceModuleParser#parseFile} is the standard strategy.
 */
@FunctionalInterface
public interface IParseStrategy {

    /**
     * @param baseDir The project base directory.
     * @param file    The file to parse.
     * @return The file's combined document, or {@code null} if the file has nothing to parse.
     * @throws IOException If the file cannot be read.
     */
    Document parse(Path baseDir, SourceFile file) throws IOException;
}
