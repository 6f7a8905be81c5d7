package org.embedql.compiler.diagnostics;

/**
 * Thrown when an embedded literal cannot be turned into definitions: either it parses to
 * zero definitions, or the grammar parser rejects its text. In the latter case the grammar
 * parser's exception is the cause and its message is carried over unchanged.
 */
public class MalformedLiteralException extends SourceModuleException {

    private final String filePath;
    private final String literalText;

    /**
     * @param message     Description of the problem.
     * @param filePath    The file containing the literal, relative to the base directory.
     * @param literalText The offending literal text.
     */
    public MalformedLiteralException(String message, String filePath, String literalText) {
        super(message);
        this.filePath = filePath;
        this.literalText = literalText;
    }

    /**
     * @param message     Description of the problem.
     * @param filePath    The file containing the literal, relative to the base directory.
     * @param literalText The offending literal text.
     * @param cause       The grammar parser's error.
     */
    public MalformedLiteralException(String message, String filePath, String literalText, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
        this.literalText = literalText;
    }

    public String filePath() {
        return filePath;
    }

    public String literalText() {
        return literalText;
    }
}
