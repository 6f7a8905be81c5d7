package org.embedql.compiler.diagnostics;

/**
 * Base class for all failures raised while extracting and parsing the embedded literals of a
 * source module.
 * <p>
 * This is a RuntimeException because these failures indicate either a misuse of the parser
 * pipeline or malformed user source. Neither can be recovered from automatically; the caller
 * re-invokes the pipeline once the underlying condition is fixed.
 */
public class SourceModuleException extends RuntimeException {

    /**
     * @param message Description of the failure.
     */
    public SourceModuleException(String message) {
        super(message);
    }

    /**
     * @param message Description of the failure.
     * @param cause   The underlying exception.
     */
    public SourceModuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
