package org.embedql.compiler.frontend.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Centralizes file loading for the parser pipeline. Paths are always resolved against the
 * project base directory so that the logical name of a file stays its relative path.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The relative path used for cache keys and diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads a file relative to a base directory.
     *
     * @param baseDir The project base directory.
     * @param relPath The path relative to {@code baseDir}.
     * @return The loaded content and the relative path as logical name.
     * @throws IOException If the file does not exist or cannot be read.
     */
    public static LoadResult loadFile(Path baseDir, String relPath) throws IOException {
        Path resolved = resolve(baseDir, relPath);
        if (!Files.isRegularFile(resolved)) {
            throw new NoSuchFileException(resolved.toString(), null, "File not found");
        }
        String content = normalizeLineEndings(Files.readString(resolved, StandardCharsets.UTF_8));
        return new LoadResult(content, relPath.replace('\\', '/'));
    }

    /**
     * Resolves a relative path against the base directory.
     *
     * @param baseDir The project base directory.
     * @param relPath The path relative to {@code baseDir}.
     * @return The normalized absolute-or-relative path.
     */
    public static Path resolve(Path baseDir, String relPath) {
        return baseDir.resolve(relPath).normalize();
    }

    /**
     * Converts a path below {@code baseDir} into the relative form used as file identity.
     *
     * @param baseDir The project base directory.
     * @param file    A path below {@code baseDir}.
     * @return The relative path with {@code /} separators.
     */
    public static String relativize(Path baseDir, Path file) {
        return baseDir.relativize(file).normalize().toString().replace('\\', '/');
    }

    static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
