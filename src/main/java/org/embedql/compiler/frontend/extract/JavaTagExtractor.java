package org.embedql.compiler.frontend.extract;

import org.embedql.compiler.api.SourceFile;
import org.embedql.compiler.api.SourceInfo;
import org.embedql.compiler.diagnostics.ExtractionException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts literals from Java files. A literal is a string literal or text block directly
 * preceded by a {@code /* graphql *}{@code /} marker comment:
 * <pre>
 *   static final String QUERY = /* graphql *&#47; """
 *       query UserViewQuery { viewer { id } }
 *       """;
 * </pre>
 *
 * <p>Text block content is taken verbatim (incidental indentation is insignificant to the
 * query language). Escape sequences in ordinary string literals are decoded, including
 * unicode escapes; an invalid escape in a marked literal is an error.
 * The module name used for name validation is the file's top-level type name.
 */
public class JavaTagExtractor implements ITagExtractor {

    static final String MARKER = "graphql";

    @Override
    public List<LiteralSpan> extract(String text, Path baseDir, SourceFile file, ExtractionOptions options) {
        List<LiteralSpan> literals = new Scanner(text, file.relPath()).scan();
        if (options.validateNames()) {
            String moduleName = ModuleNames.javaModuleName(file.relPath());
            for (LiteralSpan literal : literals) {
                ModuleNames.validate(literal, moduleName);
            }
        }
        return literals;
    }

    /**
     * Single-pass scanner over one file's text.
     */
    private static final class Scanner {

        private final String text;
        private final String filePath;
        private final List<LiteralSpan> literals = new ArrayList<>();

        private int pos = 0;
        private int line = 1;
        private int lineStart = 0;

        Scanner(String text, String filePath) {
            this.text = text;
            this.filePath = filePath;
        }

        List<LiteralSpan> scan() {
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (text.startsWith("//", pos)) {
                    while (pos < text.length() && text.charAt(pos) != '\n') {
                        pos++;
                    }
                } else if (text.startsWith("/*", pos)) {
                    SourceInfo commentLocation = location(pos);
                    String comment = readBlockComment();
                    if (MARKER.equals(comment.trim())) {
                        readMarkedLiteral(commentLocation);
                    }
                } else if (text.startsWith("\"\"\"", pos)) {
                    readTextBlock(false);
                } else if (c == '"') {
                    readString(false);
                } else if (c == '\'') {
                    skipCharLiteral();
                } else {
                    advanceOne();
                }
            }
            return literals;
        }

        private void readMarkedLiteral(SourceInfo markerLocation) {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                advanceOne();
            }
            if (text.startsWith("\"\"\"", pos)) {
                literals.add(readTextBlock(true));
            } else if (pos < text.length() && text.charAt(pos) == '"') {
                literals.add(readString(true));
            } else {
                throw new ExtractionException(
                        "Expected a string literal or text block after the /* " + MARKER + " */ marker.",
                        markerLocation);
            }
        }

        private String readBlockComment() {
            pos += 2;
            int start = pos;
            while (pos < text.length() && !text.startsWith("*/", pos)) {
                advanceOne();
            }
            String content = text.substring(start, pos);
            pos = Math.min(text.length(), pos + 2);
            return content;
        }

        /**
         * Reads a text block. Unterminated blocks are an error only for marked literals;
         * anywhere else the rest of the file is skipped.
         */
        private LiteralSpan readTextBlock(boolean marked) {
            SourceInfo opening = location(pos);
            pos += 3;
            // content starts after the line terminator that follows the opening delimiter
            while (pos < text.length() && text.charAt(pos) != '\n') {
                pos++;
            }
            if (pos < text.length()) {
                advanceOne();
            }
            SourceInfo start = location(pos);
            int contentStart = pos;
            while (pos < text.length()) {
                if (text.startsWith("\\\"\"\"", pos)) {
                    pos += 4;
                    continue;
                }
                if (text.startsWith("\"\"\"", pos)) {
                    String content = text.substring(contentStart, pos);
                    pos += 3;
                    return new LiteralSpan(content, start, null);
                }
                advanceOne();
            }
            if (marked) {
                throw new ExtractionException("Unterminated text block.", opening);
            }
            return null;
        }

        private LiteralSpan readString(boolean marked) {
            SourceInfo opening = location(pos);
            pos++;
            SourceInfo start = location(pos);
            StringBuilder content = new StringBuilder();
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '"') {
                    pos++;
                    return new LiteralSpan(content.toString(), start, null);
                }
                if (c == '\n') {
                    break;
                }
                if (c == '\\') {
                    SourceInfo escapeLocation = location(pos);
                    int decoded = readEscape();
                    if (decoded >= 0) {
                        content.append((char) decoded);
                    } else if (marked) {
                        throw new ExtractionException("Invalid escape sequence in string literal.", escapeLocation);
                    }
                    continue;
                }
                content.append(c);
                pos++;
            }
            if (marked) {
                throw new ExtractionException("Unterminated string literal.", opening);
            }
            return null;
        }

        private void skipCharLiteral() {
            pos++;
            while (pos < text.length() && text.charAt(pos) != '\'' && text.charAt(pos) != '\n') {
                pos += text.charAt(pos) == '\\' ? 2 : 1;
            }
            if (pos < text.length() && text.charAt(pos) == '\'') {
                pos++;
            }
        }

        /**
         * Decodes the escape sequence at {@code pos} and moves past it. Unicode escapes may
         * repeat the {@code u}; octal escapes take up to three digits with a maximum of
         * {@code \377}.
         *
         * @return The decoded character, or -1 if the sequence is invalid.
         */
        private int readEscape() {
            pos++;
            if (pos >= text.length() || text.charAt(pos) == '\n') {
                return -1;
            }
            char escaped = text.charAt(pos);
            if (escaped == 'u') {
                while (pos < text.length() && text.charAt(pos) == 'u') {
                    pos++;
                }
                if (pos + 4 > text.length()) {
                    return -1;
                }
                int value = 0;
                for (int i = 0; i < 4; i++) {
                    int digit = Character.digit(text.charAt(pos), 16);
                    if (digit < 0) {
                        return -1;
                    }
                    value = value * 16 + digit;
                    pos++;
                }
                return value;
            }
            if (escaped >= '0' && escaped <= '7') {
                int maxDigits = escaped <= '3' ? 3 : 2;
                int value = 0;
                for (int i = 0; i < maxDigits && pos < text.length(); i++) {
                    char digit = text.charAt(pos);
                    if (digit < '0' || digit > '7') {
                        break;
                    }
                    value = value * 8 + (digit - '0');
                    pos++;
                }
                return value;
            }
            pos++;
            return switch (escaped) {
                case 'n' -> '\n';
                case 't' -> '\t';
                case 'r' -> '\r';
                case 'b' -> '\b';
                case 'f' -> '\f';
                case 's' -> ' ';
                case '"', '\'', '\\' -> escaped;
                default -> -1;
            };
        }

        private void advanceOne() {
            if (text.charAt(pos) == '\n') {
                pos++;
                line++;
                lineStart = pos;
            } else {
                pos++;
            }
        }

        private SourceInfo location(int offset) {
            return new SourceInfo(filePath, line, offset - lineStart + 1);
        }
    }
}
