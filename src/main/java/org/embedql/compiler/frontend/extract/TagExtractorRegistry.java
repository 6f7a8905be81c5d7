package org.embedql.compiler.frontend.extract;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Registry of tag extractors, keyed by the host-language name used in configuration
 * ({@code embedql.parser.extractor}).
 */
public class TagExtractorRegistry {

    private final Map<String, ITagExtractor> extractors = new TreeMap<>();

    /**
     * Registers an extractor.
     * @param name      The host-language name (case-insensitive).
     * @param extractor The extractor for this host language.
     */
    public void register(String name, ITagExtractor extractor) {
        extractors.put(name.toLowerCase(), extractor);
    }

    /**
     * Looks up an extractor.
     * @param name The host-language name.
     * @return The extractor, or empty if none is registered under this name.
     */
    public Optional<ITagExtractor> get(String name) {
        return Optional.ofNullable(extractors.get(name.toLowerCase()));
    }

    /**
     * @return The registered names in sorted order.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(extractors.keySet());
    }

    /**
     * Creates a registry with all built-in extractors.
     * @return A new registry instance.
     */
    public static TagExtractorRegistry initialize() {
        TagExtractorRegistry registry = new TagExtractorRegistry();
        registry.register("javascript", new JavaScriptTagExtractor());
        registry.register("java", new JavaTagExtractor());
        return registry;
    }
}
