package org.embedql.compiler.frontend.extract;

import org.embedql.compiler.api.SourceFile;
import org.embedql.compiler.api.SourceInfo;
import org.embedql.compiler.diagnostics.ExtractionException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Extracts {@code graphql} tagged template literals from JavaScript and TypeScript files.
 *
 * <p>Recognized forms:
 * <pre>
 *   graphql`query UserQuery { user { id } }`
 *   graphql.experimental`fragment User_user on User { id }`
 *   createFragmentContainer(User, { user: graphql`...` })   // key name "user"
 * </pre>
 *
 * <p>The scanner skips comments, quoted strings, regular expression literals and the text of
 * ordinary template literals so that the word {@code graphql} appearing there is not mistaken
 * for a tag. Tags inside the substitutions of an ordinary template are extracted.
 * Substitutions ({@code ${...}}) inside a tagged literal are rejected.
 */
public class JavaScriptTagExtractor implements ITagExtractor {

    private static final String TAG = "graphql";
    private static final String EXPERIMENTAL_SUFFIX = ".experimental";

    /** Keywords after which a slash starts a regular expression rather than a division. */
    private static final Set<String> KEYWORDS_BEFORE_EXPRESSION = Set.of(
            "return", "typeof", "instanceof", "in", "of", "new", "delete", "void",
            "throw", "case", "do", "else", "yield", "await");

    @Override
    public List<LiteralSpan> extract(String text, Path baseDir, SourceFile file, ExtractionOptions options) {
        List<LiteralSpan> literals = new Scanner(text, file.relPath()).scan();
        if (options.validateNames()) {
            String moduleName = ModuleNames.scriptModuleName(file.relPath());
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
        private boolean regexAllowed = true;

        Scanner(String text, String filePath) {
            this.text = text;
            this.filePath = filePath;
        }

        List<LiteralSpan> scan() {
            while (pos < text.length()) {
                step();
            }
            return literals;
        }

        /**
         * Consumes one token, a comment, or one character of whitespace or punctuation.
         */
        private void step() {
            char c = text.charAt(pos);
            if (c == '\n') {
                newLine();
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (text.startsWith("//", pos)) {
                skipLineComment();
            } else if (text.startsWith("/*", pos)) {
                skipBlockComment();
            } else if (c == '/' && regexAllowed) {
                skipRegex();
                regexAllowed = false;
            } else if (c == '\'' || c == '"') {
                skipQuoted(c);
                regexAllowed = false;
            } else if (c == '`') {
                skipTemplate();
                regexAllowed = false;
            } else if (startsTag()) {
                readTaggedLiteral();
                regexAllowed = false;
            } else if (Character.isJavaIdentifierPart(c)) {
                regexAllowed = KEYWORDS_BEFORE_EXPRESSION.contains(readWord());
            } else {
                pos++;
                // after a closing paren or bracket a slash divides
                regexAllowed = c != ')' && c != ']';
            }
        }

        private boolean startsTag() {
            if (!text.startsWith(TAG, pos)) {
                return false;
            }
            if (pos > 0) {
                char before = text.charAt(pos - 1);
                if (Character.isJavaIdentifierPart(before) || before == '.') {
                    return false;
                }
            }
            int after = pos + TAG.length();
            if (text.startsWith(EXPERIMENTAL_SUFFIX, after)) {
                after += EXPERIMENTAL_SUFFIX.length();
            }
            after = skipInlineWhitespace(after);
            return after < text.length() && text.charAt(after) == '`';
        }

        private void readTaggedLiteral() {
            String keyName = findKeyName(pos);
            SourceInfo tagLocation = location(pos);
            pos += TAG.length();
            if (text.startsWith(EXPERIMENTAL_SUFFIX, pos)) {
                pos += EXPERIMENTAL_SUFFIX.length();
            }
            while (text.charAt(pos) != '`') {
                advanceOne();
            }
            pos++; // opening backtick
            SourceInfo start = location(pos);
            int contentStart = pos;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '`') {
                    literals.add(new LiteralSpan(text.substring(contentStart, pos), start, keyName));
                    pos++;
                    return;
                }
                if (c == '\\') {
                    advanceOne();
                    if (pos < text.length()) {
                        advanceOne();
                    }
                    continue;
                }
                if (text.startsWith("${", pos)) {
                    throw new ExtractionException("Substitutions are not allowed in graphql tags.", location(pos));
                }
                advanceOne();
            }
            throw new ExtractionException("Unterminated graphql tagged template.", tagLocation);
        }

        /**
         * Looks backwards from a tag for an object-property key ({@code key: graphql`...`}).
         */
        private String findKeyName(int tagStart) {
            int i = tagStart - 1;
            while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
                i--;
            }
            if (i < 0 || text.charAt(i) != ':') {
                return null;
            }
            i--;
            while (i >= 0 && Character.isWhitespace(text.charAt(i))) {
                i--;
            }
            if (i >= 0 && (text.charAt(i) == '\'' || text.charAt(i) == '"')) {
                char quote = text.charAt(i);
                int end = i;
                int begin = text.lastIndexOf(quote, end - 1);
                return begin < 0 ? null : text.substring(begin + 1, end);
            }
            int end = i + 1;
            while (i >= 0 && Character.isJavaIdentifierPart(text.charAt(i))) {
                i--;
            }
            return end > i + 1 ? text.substring(i + 1, end) : null;
        }

        private void skipLineComment() {
            while (pos < text.length() && text.charAt(pos) != '\n') {
                pos++;
            }
        }

        private void skipBlockComment() {
            pos += 2;
            while (pos < text.length() && !text.startsWith("*/", pos)) {
                advanceOne();
            }
            pos = Math.min(text.length(), pos + 2);
        }

        private void skipQuoted(char quote) {
            pos++;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '\\') {
                    pos++;
                    if (pos < text.length()) {
                        advanceOne();
                    }
                    continue;
                }
                if (c == quote || c == '\n') {
                    // an unterminated quote ends at the line break, as in the host language
                    if (c == quote) {
                        pos++;
                    }
                    return;
                }
                pos++;
            }
        }

        private void skipTemplate() {
            pos++;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '`') {
                    pos++;
                    return;
                }
                if (c == '\\') {
                    advanceOne();
                    if (pos < text.length()) {
                        advanceOne();
                    }
                    continue;
                }
                if (text.startsWith("${", pos)) {
                    skipSubstitution();
                    continue;
                }
                advanceOne();
            }
        }

        /**
         * Skips the expression of a {@code ${...}} substitution in an ordinary template. Tags
         * inside the expression are still extracted.
         */
        private void skipSubstitution() {
            pos += 2;
            regexAllowed = true;
            int depth = 1;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '{') {
                    depth++;
                    pos++;
                    regexAllowed = true;
                } else if (c == '}') {
                    pos++;
                    if (--depth == 0) {
                        return;
                    }
                    regexAllowed = true;
                } else {
                    step();
                }
            }
        }

        /**
         * Skips a regular expression literal including its flags. Slashes inside a character
         * class do not end it. An unterminated literal ends at the line break.
         */
        private void skipRegex() {
            pos++;
            boolean inClass = false;
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '\n') {
                    return;
                }
                if (c == '\\') {
                    pos++;
                    if (pos < text.length() && text.charAt(pos) != '\n') {
                        pos++;
                    }
                    continue;
                }
                if (c == '[') {
                    inClass = true;
                } else if (c == ']') {
                    inClass = false;
                } else if (c == '/' && !inClass) {
                    pos++;
                    readWord();
                    return;
                }
                pos++;
            }
        }

        private String readWord() {
            int start = pos;
            while (pos < text.length() && Character.isJavaIdentifierPart(text.charAt(pos))) {
                pos++;
            }
            return text.substring(start, pos);
        }

        private int skipInlineWhitespace(int from) {
            int i = from;
            while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                i++;
            }
            return i;
        }

        private void advanceOne() {
            if (text.charAt(pos) == '\n') {
                newLine();
            } else {
                pos++;
            }
        }

        private void newLine() {
            pos++;
            line++;
            lineStart = pos;
        }

        private SourceInfo location(int offset) {
            return new SourceInfo(filePath, line, offset - lineStart + 1);
        }
    }
}
