package org.embedql.compiler.frontend.extract;

import org.embedql.compiler.api.SourceFile;

import java.nio.file.Path;
import java.util.List;

/**
 * Locates query-language literals embedded in the text of a host file.
 * <p>
 * Each host language embeds literals differently, so each convention is a separate
 * implementation. The parser pipeline only depends on this interface and never inspects
 * which implementation is installed.
 * <p>
 * Implementations must be pure with respect to their arguments: no hidden state and no I/O.
 * This is what allows {@link MemoizedTagExtractor} to cache their results.
 */
@FunctionalInterface
public interface ITagExtractor {

    /**
     * Extracts all literals from a file's text.
     *
     * @param text    The complete text of the file.
     * @param baseDir The project base directory.
     * @param file    The file the text belongs to.
     * @param options Extraction options.
     * @return The literals in the order they appear in {@code text}.
     * @throws org.embedql.compiler.diagnostics.ExtractionException If a literal fails
     *         extractor-level validation.
     */
    List<LiteralSpan> extract(String text, Path baseDir, SourceFile file, ExtractionOptions options);
}
