package org.embedql.compiler.frontend.cache;

import org.embedql.compiler.api.SourceFile;
import org.embedql.compiler.diagnostics.ModuleParseException;
import org.embedql.compiler.diagnostics.SourceModuleException;
import org.embedql.compiler.frontend.io.ContentSignature;
import org.embedql.compiler.frontend.io.ISourceReader;
import org.embedql.compiler.frontend.parser.ast.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-file document cache for one base directory.
 *
 * <p>Entries are keyed by relative path and tagged with the content signature of the file at
 * the time it was parsed. A lookup with a different signature replaces the entry.
 *
 * <p>Lookups are single-flight: when several threads ask for the same path and signature at
 * once, exactly one of them runs the parse strategy and the others wait for its result.
 * Failed parses are never cached. A failure leaves the cache exactly as it was before the
 * attempt, so the next lookup retries. A document whose file changed during the parse is
 * returned but not kept.
 *
 * <p><strong>Thread Safety:</strong> all methods may be called concurrently.
 */
public class AstCache {

    private static final Logger log = LoggerFactory.getLogger(AstCache.class);

    /**
     * @param signature The content signature the document was parsed from.
     * @param document  The pending or completed parse.
     */
    private record Entry(String signature, CompletableFuture<Document> document) {}

    private final Path baseDir;
    private final IParseStrategy strategy;
    private final ISourceReader sourceReader;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong parseCount = new AtomicLong();

    /**
     * @param baseDir      The base directory all relative paths resolve against.
     * @param strategy     Produces documents on cache misses.
     * @param sourceReader Reads files that carry no precomputed hash.
     */
    public AstCache(Path baseDir, IParseStrategy strategy, ISourceReader sourceReader) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.sourceReader = Objects.requireNonNull(sourceReader, "sourceReader");
    }

    /**
     * Returns the document of a file, parsing it only if no document for its current content
     * signature is cached.
     *
     * @param file The file to look up.
     * @return The cached or freshly parsed document, or {@code null} if the strategy found
     *         nothing to parse.
     * @throws IOException If the file cannot be read.
     * @throws SourceModuleException If the parse fails.
     */
    public Document get(SourceFile file) throws IOException {
        String relPath = file.relPath();
        String signature = ContentSignature.of(sourceReader, baseDir, file);

        CompletableFuture<Document> ours = new CompletableFuture<>();
        Entry[] previous = new Entry[1];
        Entry current = entries.compute(relPath, (key, existing) -> {
            if (existing != null && existing.signature().equals(signature)) {
                return existing;
            }
            previous[0] = existing;
            return new Entry(signature, ours);
        });

        if (current.document() != ours) {
            log.trace("Cache hit for {}", relPath);
            return await(current.document());
        }

        log.debug("Parsing {} (signature {})", relPath, abbreviate(signature));
        parseCount.incrementAndGet();
        Document document;
        try {
            document = strategy.parse(baseDir, file);
        } catch (IOException | RuntimeException | Error e) {
            rollback(relPath, current, previous[0]);
            ours.completeExceptionally(e);
            throw e;
        }
        if (document == null || !signatureStillMatches(file, signature)) {
            entries.remove(relPath, current);
        }
        ours.complete(document);
        return document;
    }

    /**
     * The strategy reads the file on its own, so the content may have changed after the
     * signature was taken. A document parsed from other content must not be kept under the
     * old signature. Files with a precomputed hash are trusted as they are.
     */
    private boolean signatureStillMatches(SourceFile file, String signature) {
        if (file.hasHash()) {
            return true;
        }
        try {
            if (ContentSignature.of(sourceReader, baseDir, file).equals(signature)) {
                return true;
            }
            log.debug("{} changed while it was parsed, not caching the result", file.relPath());
        } catch (IOException e) {
            log.debug("{} became unreadable while it was parsed, not caching the result: {}",
                    file.relPath(), e.getMessage());
        }
        return false;
    }

    /**
     * Parses a batch of files and returns the documents of those that yielded one. Files
     * marked as deleted are evicted instead of parsed. The first failure aborts the batch.
     *
     * @param files The files of one build pass.
     * @return An unmodifiable map from relative path to document, in the order of {@code files}.
     * @throws ModuleParseException If a file fails to parse; the original failure is the cause.
     */
    public Map<String, Document> parseFiles(Collection<SourceFile> files) {
        Map<String, Document> documents = new LinkedHashMap<>();
        for (SourceFile file : files) {
            if (!file.exists()) {
                evict(file.relPath());
                continue;
            }
            try {
                Document document = get(file);
                if (document != null) {
                    documents.put(file.relPath(), document);
                }
            } catch (IOException | RuntimeException e) {
                throw new ModuleParseException(file.relPath(), e);
            }
        }
        return Collections.unmodifiableMap(documents);
    }

    /**
     * Returns the successfully parsed documents currently cached. Pending parses are not
     * included.
     *
     * @return A snapshot map from relative path to document.
     */
    public Map<String, Document> documents() {
        Map<String, Document> snapshot = new LinkedHashMap<>();
        entries.forEach((relPath, entry) -> {
            CompletableFuture<Document> future = entry.document();
            if (future.isDone() && !future.isCompletedExceptionally()) {
                Document document = future.getNow(null);
                if (document != null) {
                    snapshot.put(relPath, document);
                }
            }
        });
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Drops the entry of a file.
     *
     * @param relPath The file path relative to the base directory.
     * @return {@code true} if an entry was removed.
     */
    public boolean evict(String relPath) {
        boolean removed = entries.remove(relPath.replace('\\', '/')) != null;
        if (removed) {
            log.debug("Evicted {}", relPath);
        }
        return removed;
    }

    public void clear() {
        entries.clear();
    }

    /**
     * @return The number of cached or pending entries.
     */
    public int size() {
        return entries.size();
    }

    /**
     * @return How many times the parse strategy has been invoked.
     */
    public long parseCount() {
        return parseCount.get();
    }

    public Path baseDir() {
        return baseDir;
    }

    /**
     * Puts the entry that was replaced by a failed attempt back, unless another thread has
     * installed a newer entry in the meantime.
     */
    private void rollback(String relPath, Entry failed, Entry previous) {
        entries.compute(relPath, (key, existing) -> {
            if (existing != failed) {
                return existing;
            }
            if (previous != null && !previous.document().isCompletedExceptionally()) {
                return previous;
            }
            return null;
        });
    }

    private static Document await(CompletableFuture<Document> future) throws IOException {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new SourceModuleException("Parse failed", cause);
        }
    }

    private static String abbreviate(String signature) {
        return signature.length() > 12 ? signature.substring(0, 12) : signature;
    }
}
