package org.embedql.compiler.frontend.lexer;

import org.embedql.compiler.frontend.parser.Source;
import org.embedql.compiler.frontend.parser.SyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts query-language text into a list of tokens.
 * <p>
 * Whitespace, line terminators, commas and {@code #} comments are insignificant and produce
 * no tokens. The returned list always ends with an {@link TokenType#EOF} token.
 */
public class Lexer {

    private final Source source;
    private final String body;
    private final List<Token> tokens = new ArrayList<>();

    private int pos = 0;
    private int line = 1;
    private int lineStart = 0;

    /**
     * @param source The text to tokenize.
     */
    public Lexer(Source source) {
        this.source = source;
        this.body = source.body();
    }

    /**
     * Scans the whole source.
     *
     * @return The tokens, terminated by an EOF token.
     * @throws SyntaxException If an unexpected character or an unterminated string is found.
     */
    public List<Token> scanTokens() {
        while (true) {
            skipIgnored();
            if (pos >= body.length()) {
                tokens.add(new Token(TokenType.EOF, "", source.locate(line, column(pos))));
                return tokens;
            }
            scanToken();
        }
    }

    private void scanToken() {
        int start = pos;
        char c = body.charAt(pos);
        switch (c) {
            case '!' -> single(TokenType.BANG, start);
            case '$' -> single(TokenType.DOLLAR, start);
            case '&' -> single(TokenType.AMP, start);
            case '(' -> single(TokenType.PAREN_L, start);
            case ')' -> single(TokenType.PAREN_R, start);
            case ':' -> single(TokenType.COLON, start);
            case '=' -> single(TokenType.EQUALS, start);
            case '@' -> single(TokenType.AT, start);
            case '[' -> single(TokenType.BRACKET_L, start);
            case ']' -> single(TokenType.BRACKET_R, start);
            case '{' -> single(TokenType.BRACE_L, start);
            case '|' -> single(TokenType.PIPE, start);
            case '}' -> single(TokenType.BRACE_R, start);
            case '.' -> {
                if (body.startsWith("...", pos)) {
                    pos += 3;
                    add(TokenType.SPREAD, start);
                } else {
                    throw error("Unexpected character: \".\"", start);
                }
            }
            case '"' -> {
                if (body.startsWith("\"\"\"", pos)) {
                    scanBlockString(start);
                } else {
                    scanString(start);
                }
            }
            default -> {
                if (isNameStart(c)) {
                    scanName(start);
                } else if (c == '-' || isDigit(c)) {
                    scanNumber(start);
                } else {
                    throw error("Unexpected character: \"" + printable(c) + "\"", start);
                }
            }
        }
    }

    private void skipIgnored() {
        while (pos < body.length()) {
            char c = body.charAt(pos);
            if (c == '\uFEFF' || c == ' ' || c == '\t' || c == ',') {
                pos++;
            } else if (c == '\n') {
                newLine(pos + 1);
                pos++;
            } else if (c == '#') {
                while (pos < body.length() && body.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                return;
            }
        }
    }

    private void scanName(int start) {
        pos++;
        while (pos < body.length() && isNameContinue(body.charAt(pos))) {
            pos++;
        }
        add(TokenType.NAME, start);
    }

    private void scanNumber(int start) {
        boolean isFloat = false;
        if (peekIs('-')) {
            pos++;
        }
        if (peekIs('0')) {
            pos++;
            if (pos < body.length() && isDigit(body.charAt(pos))) {
                throw error("Invalid number, unexpected digit after 0: \"" + body.charAt(pos) + "\"", pos);
            }
        } else {
            readDigits();
        }
        if (peekIs('.')) {
            isFloat = true;
            pos++;
            readDigits();
        }
        if (peekIs('e') || peekIs('E')) {
            isFloat = true;
            pos++;
            if (peekIs('+') || peekIs('-')) {
                pos++;
            }
            readDigits();
        }
        if (pos < body.length() && (body.charAt(pos) == '.' || isNameStart(body.charAt(pos)))) {
            throw error("Invalid number, expected digit but got: \"" + printable(body.charAt(pos)) + "\"", pos);
        }
        add(isFloat ? TokenType.FLOAT : TokenType.INT, start);
    }

    private void readDigits() {
        if (pos >= body.length() || !isDigit(body.charAt(pos))) {
            String found = pos >= body.length() ? "<EOF>" : "\"" + printable(body.charAt(pos)) + "\"";
            throw error("Invalid number, expected digit but got: " + found, pos);
        }
        while (pos < body.length() && isDigit(body.charAt(pos))) {
            pos++;
        }
    }

    private void scanString(int start) {
        pos++;
        while (pos < body.length()) {
            char c = body.charAt(pos);
            if (c == '"') {
                pos++;
                add(TokenType.STRING, start);
                return;
            }
            if (c == '\n') {
                break;
            }
            if (c == '\\') {
                pos++;
                if (pos >= body.length()) {
                    break;
                }
                char escaped = body.charAt(pos);
                if (escaped == 'u') {
                    if (pos + 4 >= body.length() || !isHex(body.substring(pos + 1, pos + 5))) {
                        throw error("Invalid Unicode escape sequence.", pos - 1);
                    }
                    pos += 4;
                } else if ("\"\\/bfnrt".indexOf(escaped) < 0) {
                    throw error("Invalid character escape sequence: \"\\" + printable(escaped) + "\".", pos - 1);
                }
            }
            pos++;
        }
        throw error("Unterminated string.", start);
    }

    private void scanBlockString(int start) {
        int startLine = line;
        int startLineStart = lineStart;
        pos += 3;
        while (pos < body.length()) {
            if (body.startsWith("\"\"\"", pos)) {
                pos += 3;
                tokens.add(new Token(TokenType.BLOCK_STRING, body.substring(start, pos),
                        source.locate(startLine, start - startLineStart + 1)));
                return;
            }
            if (body.startsWith("\\\"\"\"", pos)) {
                pos += 4;
                continue;
            }
            if (body.charAt(pos) == '\n') {
                newLine(pos + 1);
            }
            pos++;
        }
        line = startLine;
        lineStart = startLineStart;
        throw error("Unterminated string.", start);
    }

    private void single(TokenType type, int start) {
        pos++;
        add(type, start);
    }

    private void add(TokenType type, int start) {
        tokens.add(new Token(type, body.substring(start, pos), source.locate(line, column(start))));
    }

    private void newLine(int nextLineStart) {
        line++;
        lineStart = nextLineStart;
    }

    private int column(int offset) {
        return offset - lineStart + 1;
    }

    private boolean peekIs(char c) {
        return pos < body.length() && body.charAt(pos) == c;
    }

    private SyntaxException error(String detail, int offset) {
        return new SyntaxException(detail, source.locate(line, column(offset)));
    }

    private static boolean isNameStart(char c) {
        return c == '_' || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isNameContinue(char c) {
        return isNameStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHex(String digits) {
        for (int i = 0; i < digits.length(); i++) {
            if (Character.digit(digits.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private static String printable(char c) {
        if (c < 0x20 || c == 0x7F) {
            return String.format("\\u%04X", (int) c);
        }
        return String.valueOf(c);
    }
}
