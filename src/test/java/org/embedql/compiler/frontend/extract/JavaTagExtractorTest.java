package org.embedql.compiler.frontend.extract;

import org.embedql.compiler.api.SourceFile;
import org.embedql.compiler.diagnostics.ExtractionException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class JavaTagExtractorTest {

    private static final String TB = "\"\"\"";
    private static final Path BASE_DIR = Path.of("/project");

    private final JavaTagExtractor extractor = new JavaTagExtractor();

    private List<LiteralSpan> extract(String relPath, String text, ExtractionOptions options) {
        return extractor.extract(text, BASE_DIR, SourceFile.of(relPath), options);
    }

    @Test
    void extractsMarkedTextBlocksAndStrings() {
        String text = "class Queries {\n"
                + "    static final String Q = /* graphql */ " + TB + "\n"
                + "        query QueriesQuery { id }\n"
                + "        " + TB + ";\n"
                + "    static final String F = /* graphql */ \"fragment Queries_user on User { name }\";\n"
                + "    String other = \"graphql is mentioned\";\n"
                + "}\n";

        List<LiteralSpan> literals = extract("src/com/acme/Queries.java", text, ExtractionOptions.DEFAULT);

        assertThat(literals).hasSize(2);
        assertThat(literals.get(0).text()).isEqualTo("        query QueriesQuery { id }\n        ");
        assertThat(literals.get(0).location().lineNumber()).isEqualTo(3);
        assertThat(literals.get(0).location().columnNumber()).isEqualTo(1);
        assertThat(literals.get(1).text()).isEqualTo("fragment Queries_user on User { name }");
        assertThat(literals.get(1).location().lineNumber()).isEqualTo(5);
        assertThat(literals.get(1).filePath()).isEqualTo("src/com/acme/Queries.java");
    }

    @Test
    void unmarkedLiteralsAndOtherCommentsAreIgnored() {
        String text = "class A {\n"
                + "    // graphql\n"
                + "    String a = \"query AQuery { id }\";\n"
                + "    /* not graphql */ String b = \"{ x }\";\n"
                + "    char c = '\"';\n"
                + "}\n";

        assertThat(extract("A.java", text, ExtractionOptions.DEFAULT)).isEmpty();
    }

    @Test
    void escapesInStringLiteralsAreDecoded() {
        String text = "String q = /* graphql */ \"query AQuery { a(x: \\\"v\\\") }\";";

        List<LiteralSpan> literals = extract("A.java", text, ExtractionOptions.DEFAULT);

        assertThat(literals.get(0).text()).isEqualTo("query AQuery { a(x: \"v\") }");
    }

    @Test
    void unicodeAndOctalEscapesAreDecoded() {
        String text = "String q = /* graphql */ \"\\u0041\\uuu0042 \\101\\0\\377\";";

        List<LiteralSpan> literals = extract("A.java", text, new ExtractionOptions(false));

        assertThat(literals).extracting(LiteralSpan::text).containsExactly("AB A\0\377");
    }

    @Test
    void invalidEscapeInMarkedLiteralIsRejected() {
        String text = "class A {\n    String q = /* graphql */ \"query \\q\";\n}\n";

        assertThatThrownBy(() -> extract("A.java", text, new ExtractionOptions(false)))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Invalid escape sequence in string literal.")
                .satisfies(e -> assertThat(((ExtractionException) e).location().columnNumber()).isEqualTo(37));
    }

    @Test
    void truncatedUnicodeEscapeInMarkedLiteralIsRejected() {
        String text = "String q = /* graphql */ \"\\u00G1\";";

        assertThatThrownBy(() -> extract("A.java", text, new ExtractionOptions(false)))
                .isInstanceOf(ExtractionException.class);
    }

    @Test
    void invalidEscapeInUnmarkedLiteralIsIgnored() {
        String text = "String a = \"\\q\"; String q = /* graphql */ \"query AQuery { id }\";";

        assertThat(extract("A.java", text, new ExtractionOptions(false)))
                .extracting(LiteralSpan::text)
                .containsExactly("query AQuery { id }");
    }

    @Test
    void markerWithoutLiteralIsRejected() {
        assertThatThrownBy(() -> extract("A.java", "int x = /* graphql */ 42;", ExtractionOptions.DEFAULT))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Expected a string literal or text block after the /* graphql */ marker.");
    }

    @Test
    void unterminatedMarkedTextBlockIsRejected() {
        String text = "String q = /* graphql */ " + TB + "\n  query AQuery { id }\n";

        assertThatThrownBy(() -> extract("A.java", text, ExtractionOptions.DEFAULT))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Unterminated text block.");
    }

    @Test
    void moduleNameIsTheTopLevelTypeName() {
        String text = "String q = /* graphql */ \"query OtherQuery { id }\";";

        assertThatThrownBy(() -> extract("UserQueries.java", text, ExtractionOptions.DEFAULT))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("in module `UserQueries`");
        assertThat(extract("UserQueries.java", text, new ExtractionOptions(false))).hasSize(1);
    }
}
