package org.embedql.compiler.api;

/**
 * A position in a host source file.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param fileName     The file the position refers to (relative to the base directory).
 * @param lineNumber   The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
