package org.embedql.compiler.api;

import java.util.Objects;

/**
 * A file of the watched project, identified by its path relative to a base directory.
 * <p>
 * The build layer produces these records. {@code exists == false} signals that the file was
 * deleted since the last pass. {@code hash} is an optional precomputed content hash; when
 * absent, consumers compute a signature from the file's content.
 *
 * @param relPath The path relative to the base directory, using {@code /} as separator.
 * @param exists  Whether the file currently exists.
 * @param hash    A precomputed content hash, or {@code null} if unknown.
 */
public record SourceFile(String relPath, boolean exists, String hash) {

    public SourceFile {
        Objects.requireNonNull(relPath, "relPath");
        relPath = relPath.replace('\\', '/');
    }

    /**
     * Creates a record for an existing file without a precomputed hash.
     *
     * @param relPath The path relative to the base directory.
     * @return A new file record.
     */
    public static SourceFile of(String relPath) {
        return new SourceFile(relPath, true, null);
    }

    /**
     * Creates a record for a file that was removed from the watched set.
     *
     * @param relPath The path relative to the base directory.
     * @return A new file record marked as deleted.
     */
    public static SourceFile deleted(String relPath) {
        return new SourceFile(relPath, false, null);
    }

    /**
     * @return {@code true} if a precomputed content hash is available.
     */
    public boolean hasHash() {
        return hash != null && !hash.isEmpty();
    }
}
