package org.embedql.compiler.frontend.extract;

import com.typesafe.config.Config;

/**
 * Options passed through to a tag extractor.
 *
 * @param validateNames When {@code true}, every definition in a literal must carry a name that
 *                      follows the module naming convention of the host file.
 */
public record ExtractionOptions(boolean validateNames) {

    /** Options used by the build pipeline unless configured otherwise. */
    public static final ExtractionOptions DEFAULT = new ExtractionOptions(true);

    private static final String VALIDATE_NAMES_PATH = "validate-names";

    /**
     * Reads options from a parser configuration block ({@code embedql.parser}).
     *
     * @param parserConfig The configuration block.
     * @return The options; missing keys fall back to {@link #DEFAULT}.
     */
    public static ExtractionOptions fromConfig(Config parserConfig) {
        boolean validateNames = parserConfig.hasPath(VALIDATE_NAMES_PATH)
                ? parserConfig.getBoolean(VALIDATE_NAMES_PATH)
                : DEFAULT.validateNames();
        return new ExtractionOptions(validateNames);
    }
}
