package org.embedql.compiler.diagnostics;

/**
 * Wraps the failure of a single file during a batch parse so that the caller can tell which
 * file of the batch broke the pass. The original failure is kept as the cause.
 */
public class ModuleParseException extends SourceModuleException {

    private final String relPath;

    /**
     * @param relPath The file that failed, relative to the base directory.
     * @param cause   The original failure.
     */
    public ModuleParseException(String relPath, Throwable cause) {
        super("Parse error: " + cause.getMessage() + " in \"" + relPath + "\"", cause);
        this.relPath = relPath;
    }

    public String relPath() {
        return relPath;
    }
}
