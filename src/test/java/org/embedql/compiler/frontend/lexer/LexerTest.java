package org.embedql.compiler.frontend.lexer;

import org.embedql.compiler.frontend.parser.Source;
import org.embedql.compiler.frontend.parser.SyntaxException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class LexerTest {

    private static List<Token> scan(String text) {
        return new Lexer(Source.of(text, "test.js")).scanTokens();
    }

    @Test
    void scansPunctuatorsNamesAndNumbers() {
        List<Token> tokens = scan("query Q($n: Int = -12) { a(x: 1.5e3) ...F }");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.NAME, TokenType.NAME, TokenType.PAREN_L, TokenType.DOLLAR, TokenType.NAME,
                TokenType.COLON, TokenType.NAME, TokenType.EQUALS, TokenType.INT, TokenType.PAREN_R,
                TokenType.BRACE_L, TokenType.NAME, TokenType.PAREN_L, TokenType.NAME, TokenType.COLON,
                TokenType.FLOAT, TokenType.PAREN_R, TokenType.SPREAD, TokenType.NAME, TokenType.BRACE_R,
                TokenType.EOF);
        assertThat(tokens.get(8).text()).isEqualTo("-12");
        assertThat(tokens.get(15).text()).isEqualTo("1.5e3");
    }

    @Test
    void commasCommentsAndByteOrderMarkAreInsignificant() {
        List<Token> tokens = scan("\uFEFF# leading comment\n{ a, b # trailing\n c }");

        assertThat(tokens).extracting(Token::text).containsExactly("{", "a", "b", "c", "}", "");
    }

    @Test
    void stringsKeepTheirQuotes() {
        List<Token> tokens = scan("\"a\\n\\u00e9\" \"\"\"block\n\"quoted\" text\"\"\"");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(0).text()).isEqualTo("\"a\\n\\u00e9\"");
        assertThat(tokens.get(1).type()).isEqualTo(TokenType.BLOCK_STRING);
        assertThat(tokens.get(1).text()).startsWith("\"\"\"block");
    }

    @Test
    void tracksLinesAndColumns() {
        List<Token> tokens = scan("{\n  id\n}");

        assertThat(tokens.get(1).location().lineNumber()).isEqualTo(2);
        assertThat(tokens.get(1).location().columnNumber()).isEqualTo(3);
        assertThat(tokens.get(2).line()).isEqualTo(3);
    }

    @Test
    void locationsAreShiftedByTheSourceOffset() {
        List<Token> tokens = new Lexer(new Source("{ id\n  name }", "App.js", 10, 20)).scanTokens();

        assertThat(tokens.get(0).location().toString()).isEqualTo("App.js:10:20");
        assertThat(tokens.get(1).location().columnNumber()).isEqualTo(22);
        // continuation lines are not shifted horizontally
        assertThat(tokens.get(2).location().lineNumber()).isEqualTo(11);
        assertThat(tokens.get(2).location().columnNumber()).isEqualTo(3);
    }

    @Test
    void unterminatedStringIsRejected() {
        assertThatThrownBy(() -> scan("{ a(x: \"open) }"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageContaining("Unterminated string.");
    }

    @Test
    void unexpectedCharacterIsRejectedWithLocation() {
        assertThatThrownBy(() -> scan("{ a\n  ? }"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageContaining("Unexpected character: \"?\"")
                .satisfies(e -> assertThat(((SyntaxException) e).location().lineNumber()).isEqualTo(2));
    }

    @Test
    void numberWithLeadingZeroIsRejected() {
        assertThatThrownBy(() -> scan("{ a(x: 012) }"))
                .isInstanceOf(SyntaxException.class)
                .hasMessageContaining("unexpected digit after 0");
    }
}
