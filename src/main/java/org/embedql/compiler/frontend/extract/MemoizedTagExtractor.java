package org.embedql.compiler.frontend.extract;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.typesafe.config.Config;
import org.embedql.compiler.api.SourceFile;
import org.embedql.compiler.frontend.io.ContentSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Decorator that memoizes the results of a {@link ITagExtractor}.
 * <p>
 * Results are keyed by file path, the content signature of the exact text passed in and the
 * extraction options, so a path reused with different content never serves stale literals.
 * A hit returns the stored literals without invoking the wrapped extractor.
 * <p>
 * <strong>Thread Safety:</strong> backed by a Caffeine cache. Concurrent calls for the same
 * key invoke the wrapped extractor at most once; calls for different keys do not block each
 * other. Failed extractions are not stored. One instance may be shared by several source
 * module parsers configured with the same wrapped extractor.
 */
public class MemoizedTagExtractor implements ITagExtractor {

    private static final Logger log = LoggerFactory.getLogger(MemoizedTagExtractor.class);

    /** Default number of extraction results kept. */
    public static final int DEFAULT_MAXIMUM_SIZE = 10_000;

    private final ITagExtractor delegate;
    private final Cache<ExtractionKey, List<LiteralSpan>> cache;

    /**
     * Memo key.
     *
     * @param relPath       The file identity.
     * @param signature     The content signature of the extracted text.
     * @param validateNames The option the result was computed with.
     */
    private record ExtractionKey(String relPath, String signature, boolean validateNames) {}

    /**
     * @param delegate    The extractor to memoize.
     * @param maximumSize Maximum number of results kept; least recently used entries are evicted first.
     */
    public MemoizedTagExtractor(ITagExtractor delegate, long maximumSize) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    /**
     * @param delegate The extractor to memoize.
     */
    public MemoizedTagExtractor(ITagExtractor delegate) {
        this(delegate, DEFAULT_MAXIMUM_SIZE);
    }

    /**
     * Creates a memo sized from the {@code embedql.extraction-cache} configuration block.
     *
     * @param delegate    The extractor to memoize.
     * @param cacheConfig The configuration block; {@code maximum-size} defaults to {@value #DEFAULT_MAXIMUM_SIZE}.
     * @return A new memoizing extractor.
     */
    public static MemoizedTagExtractor fromConfig(ITagExtractor delegate, Config cacheConfig) {
        long maximumSize = cacheConfig.hasPath("maximum-size")
                ? cacheConfig.getLong("maximum-size")
                : DEFAULT_MAXIMUM_SIZE;
        return new MemoizedTagExtractor(delegate, maximumSize);
    }

    @Override
    public List<LiteralSpan> extract(String text, Path baseDir, SourceFile file, ExtractionOptions options) {
        ExtractionKey key = new ExtractionKey(file.relPath(), ContentSignature.of(text), options.validateNames());
        return cache.get(key, k -> {
            log.debug("Extracting literals from {}", file.relPath());
            return List.copyOf(delegate.extract(text, baseDir, file, options));
        });
    }

    /**
     * @return The wrapped extractor.
     */
    public ITagExtractor delegate() {
        return delegate;
    }

    /**
     * @return Hit and miss counters of the memo.
     */
    public CacheStats stats() {
        return cache.stats();
    }

    /**
     * Drops all memoized results.
     */
    public void invalidateAll() {
        cache.invalidateAll();
    }
}
