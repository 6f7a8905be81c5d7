package org.embedql.compiler.frontend.extract;

import org.embedql.compiler.api.SourceInfo;

import java.util.Objects;

/**
 * A piece of host-file text recognized as embedded query-language source.
 *
 * @param text     The literal's query-language text, without delimiters.
 * @param location Where {@code text} starts in the host file; its file name is the
 *                 originating file path used for error attribution.
 * @param keyName  The object-property key the literal is assigned to, or {@code null}.
 */
public record LiteralSpan(String text, SourceInfo location, String keyName) {

    public LiteralSpan {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(location, "location");
    }

    /**
     * @return The path of the file the literal was extracted from.
     */
    public String filePath() {
        return location.fileName();
    }
}
