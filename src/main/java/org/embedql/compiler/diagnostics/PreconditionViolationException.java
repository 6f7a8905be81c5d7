package org.embedql.compiler.diagnostics;

/**
 * Thrown when the source module parser is handed a file that the file filter should have
 * excluded. Indicates a programming error in the caller, not malformed user source.
 */
public class PreconditionViolationException extends SourceModuleException {

    private final String filePath;

    /**
     * @param message  Description of the violated contract.
     * @param filePath The offending file, relative to the base directory.
     */
    public PreconditionViolationException(String message, String filePath) {
        super(message);
        this.filePath = filePath;
    }

    public String filePath() {
        return filePath;
    }
}
