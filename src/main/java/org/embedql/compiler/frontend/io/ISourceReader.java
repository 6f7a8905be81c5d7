package org.embedql.compiler.frontend.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Filesystem collaborator of the parser pipeline: reads the full text of a project file.
 * Implementations must not retry; an unreadable or missing file is reported as an
 * {@link IOException} and propagated unchanged by the pipeline.
 */
@FunctionalInterface
public interface ISourceReader {

    /**
     * Reads the text of a file.
     *
     * @param baseDir The project base directory.
     * @param relPath The file path relative to {@code baseDir}.
     * @return The file content.
     * @throws IOException If the file is missing or cannot be read.
     */
    String readText(Path baseDir, String relPath) throws IOException;

    /**
     * @return The default reader backed by {@link SourceLoader}.
     */
    static ISourceReader fileSystem() {
        return (baseDir, relPath) -> SourceLoader.loadFile(baseDir, relPath).content();
    }
}
