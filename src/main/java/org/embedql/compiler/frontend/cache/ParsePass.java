package org.embedql.compiler.frontend.cache;

import org.embedql.compiler.api.SourceFile;
import org.embedql.compiler.diagnostics.SourceModuleException;
import org.embedql.compiler.frontend.parser.ast.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * One build pass over a set of files, parsed through a shared {@link AstCache}.
 * <p>
 * Unlike {@link AstCache#parseFiles}, a failing file does not abort the pass: every file is
 * attempted and failures are collected per file. With more than one thread the files are
 * parsed on a fixed thread pool; results are reported in the order of the input.
 */
public class ParsePass {

    private static final Logger log = LoggerFactory.getLogger(ParsePass.class);

    /**
     * Outcome of a pass.
     *
     * @param documents Documents of the files that parsed, keyed by relative path. Files with
     *                  nothing to parse are absent.
     * @param failures  The failure of every file that did not parse, keyed by relative path.
     */
    public record Result(Map<String, Document> documents, Map<String, Exception> failures) {

        public Result {
            documents = Collections.unmodifiableMap(new LinkedHashMap<>(documents));
            failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        }

        public boolean isSuccess() {
            return failures.isEmpty();
        }
    }

    private final AstCache cache;
    private final int threadCount;

    /**
     * @param cache       The cache all files are parsed through.
     * @param threadCount Number of worker threads; 1 parses on the calling thread.
     */
    public ParsePass(AstCache cache, int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be at least 1, got " + threadCount);
        }
        this.cache = cache;
        this.threadCount = threadCount;
    }

    /**
     * Parses all files. Files marked as deleted are evicted from the cache.
     *
     * @param files The files of this pass.
     * @return Documents and failures of the pass.
     * @throws InterruptedException If the calling thread is interrupted while waiting for workers.
     */
    public Result run(List<SourceFile> files) throws InterruptedException {
        long start = System.currentTimeMillis();
        Map<String, Document> documents = new LinkedHashMap<>();
        Map<String, Exception> failures = new LinkedHashMap<>();

        List<SourceFile> existing = new ArrayList<>();
        for (SourceFile file : files) {
            if (file.exists()) {
                existing.add(file);
            } else {
                cache.evict(file.relPath());
            }
        }

        if (threadCount == 1 || existing.size() < 2) {
            for (SourceFile file : existing) {
                collect(file, () -> cache.get(file), documents, failures);
            }
        } else {
            ExecutorService executor = Executors.newFixedThreadPool(Math.min(threadCount, existing.size()));
            try {
                List<Future<Document>> futures = new ArrayList<>(existing.size());
                for (SourceFile file : existing) {
                    futures.add(executor.submit(() -> cache.get(file)));
                }
                for (int i = 0; i < existing.size(); i++) {
                    Future<Document> future = futures.get(i);
                    collect(existing.get(i), () -> awaitFuture(future), documents, failures);
                }
            } finally {
                executor.shutdown();
                executor.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
            }
        }

        log.info("Parsed {} file(s) in {} ms: {} document(s), {} failure(s)",
                existing.size(), System.currentTimeMillis() - start, documents.size(), failures.size());
        return new Result(documents, failures);
    }

    @FunctionalInterface
    private interface DocumentSupplier {
        Document get() throws IOException, InterruptedException;
    }

    private static void collect(SourceFile file, DocumentSupplier supplier,
                                Map<String, Document> documents, Map<String, Exception> failures)
            throws InterruptedException {
        try {
            Document document = supplier.get();
            if (document != null) {
                documents.put(file.relPath(), document);
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to parse {}: {}", file.relPath(), e.getMessage());
            failures.put(file.relPath(), e);
        }
    }

    private static Document awaitFuture(Future<Document> future) throws IOException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
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
}
