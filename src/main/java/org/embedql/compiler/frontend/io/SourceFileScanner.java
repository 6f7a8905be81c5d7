package org.embedql.compiler.frontend.io;

import org.embedql.compiler.api.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the candidate files of a project: regular files below the base directory whose name
 * ends with one of the configured extensions. Hidden directories and {@code node_modules}
 * are skipped.
 * <p>
 * This is only a listing step; whether a file actually contains literals is decided by the
 * file filter of the source module parser.
 */
public final class SourceFileScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceFileScanner.class);

    private final List<String> extensions;

    /**
     * @param extensions File name suffixes to include, e.g. {@code ".js"}.
     */
    public SourceFileScanner(List<String> extensions) {
        this.extensions = List.copyOf(Objects.requireNonNull(extensions, "extensions"));
    }

    /**
     * Walks the base directory and returns all matching files in path order.
     *
     * @param baseDir The project base directory.
     * @return The candidate files, relative to {@code baseDir}.
     * @throws IOException If the directory cannot be walked.
     */
    public List<SourceFile> scan(Path baseDir) throws IOException {
        try (Stream<Path> stream = Files.walk(baseDir)) {
            List<SourceFile> files = stream
                    .filter(Files::isRegularFile)
                    .filter(path -> !isExcluded(baseDir, path))
                    .filter(this::hasMatchingExtension)
                    .map(path -> SourceFile.of(SourceLoader.relativize(baseDir, path)))
                    .sorted((a, b) -> a.relPath().compareTo(b.relPath()))
                    .collect(Collectors.toList());
            log.debug("Found {} candidate files below {}", files.size(), baseDir);
            return files;
        }
    }

    private boolean hasMatchingExtension(Path path) {
        String name = path.getFileName().toString();
        for (String extension : extensions) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isExcluded(Path baseDir, Path path) {
        Path relative = baseDir.relativize(path);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            String segment = relative.getName(i).toString();
            if (segment.startsWith(".") || segment.equals("node_modules")) {
                return true;
            }
        }
        return false;
    }
}
