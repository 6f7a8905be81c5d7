package org.embedql.compiler.diagnostics;

import org.embedql.compiler.api.SourceInfo;

/**
 * Thrown by a tag extractor when a literal fails extractor-level validation, e.g. a
 * definition name that does not follow the module naming convention, or a literal that
 * contains an interpolation.
 */
public class ExtractionException extends SourceModuleException {

    private final SourceInfo location;

    /**
     * @param message  Description of the problem, without location prefix.
     * @param location Where in the host file the offending literal starts.
     */
    public ExtractionException(String message, SourceInfo location) {
        super(location + ": " + message);
        this.location = location;
    }

    public SourceInfo location() {
        return location;
    }

    public String filePath() {
        return location.fileName();
    }
}
