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
public class JavaScriptTagExtractorTest {

    private static final Path BASE_DIR = Path.of("/project");
    private static final ExtractionOptions NO_VALIDATION = new ExtractionOptions(false);

    private final JavaScriptTagExtractor extractor = new JavaScriptTagExtractor();

    private List<LiteralSpan> extract(String relPath, String text, ExtractionOptions options) {
        return extractor.extract(text, BASE_DIR, SourceFile.of(relPath), options);
    }

    @Test
    void extractsTaggedTemplateWithLocation() {
        List<LiteralSpan> literals = extract("src/App.js",
                "import graphql from 'babel-plugin-relay/macro';\nconst q = graphql`query AppQuery { id }`;\n",
                ExtractionOptions.DEFAULT);

        assertThat(literals).hasSize(1);
        LiteralSpan literal = literals.get(0);
        assertThat(literal.text()).isEqualTo("query AppQuery { id }");
        assertThat(literal.filePath()).isEqualTo("src/App.js");
        assertThat(literal.location().lineNumber()).isEqualTo(2);
        assertThat(literal.location().columnNumber()).isEqualTo(19);
        assertThat(literal.keyName()).isNull();
    }

    @Test
    void extractsLiteralsInOrderOfAppearance() {
        String text = """
                const a = graphql`query FeedQuery { feed { id } }`;
                const b = graphql.experimental`
                  fragment Feed_item on Item { id }
                `;
                """;

        List<LiteralSpan> literals = extract("Feed.js", text, ExtractionOptions.DEFAULT);

        assertThat(literals).extracting(LiteralSpan::text).containsExactly(
                "query FeedQuery { feed { id } }",
                "\n  fragment Feed_item on Item { id }\n");
        assertThat(literals.get(1).location().lineNumber()).isEqualTo(2);
    }

    @Test
    void recordsObjectPropertyKeyName() {
        String text = "export default createFragmentContainer(User, {\n"
                + "  user: graphql`fragment User_user on User { name }`,\n"
                + "  'viewer' : graphql`fragment User_viewer on Viewer { id }`\n"
                + "});\n";

        List<LiteralSpan> literals = extract("User.js", text, ExtractionOptions.DEFAULT);

        assertThat(literals).extracting(LiteralSpan::keyName).containsExactly("user", "viewer");
    }

    @Test
    void containerFragmentNameMustMatchKey() {
        String text = "createFragmentContainer(User, { user: graphql`fragment User_person on User { name }` });";

        assertThatThrownBy(() -> extract("User.js", text, ExtractionOptions.DEFAULT))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("expected `User_user`");
    }

    @Test
    void ignoresTagInCommentsStringsAndPlainTemplates() {
        String text = """
                // graphql`query Ignored1Query { a }`
                /* graphql`query Ignored2Query { a }` */
                const s = "graphql`query Ignored3Query { a }`";
                const t = `graphql${x}`;
                const obj = foo.graphql`query Ignored4Query { a }`;
                const mygraphql = 1;
                """;

        assertThat(extract("App.js", text, ExtractionOptions.DEFAULT)).isEmpty();
    }

    @Test
    void substitutionInsideTagIsRejected() {
        String text = "const q = graphql`query AppQuery { node(id: ${id}) { id } }`;";

        assertThatThrownBy(() -> extract("App.js", text, NO_VALIDATION))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Substitutions are not allowed in graphql tags.")
                .satisfies(e -> assertThat(((ExtractionException) e).filePath()).isEqualTo("App.js"));
    }

    @Test
    void unterminatedTagIsRejected() {
        assertThatThrownBy(() -> extract("App.js", "graphql`query AppQuery { id }", NO_VALIDATION))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Unterminated graphql tagged template.");
    }

    @Test
    void namingViolationsAreIgnoredWithoutValidation() {
        String text = "graphql`query Whatever { id }`; graphql`{ anonymous }`";

        assertThat(extract("App.js", text, NO_VALIDATION)).hasSize(2);
        assertThatThrownBy(() -> extract("App.js", text, ExtractionOptions.DEFAULT))
                .isInstanceOf(ExtractionException.class);
    }

    @Test
    void emptyLiteralIsExtracted() {
        List<LiteralSpan> literals = extract("App.js", "graphql``", ExtractionOptions.DEFAULT);

        assertThat(literals).extracting(LiteralSpan::text).containsExactly("");
    }

    @Test
    void quoteInsideRegexDoesNotHideFollowingTag() {
        String text = "const r = /'/; graphql`query AQuery { id }`";

        assertThat(extract("App.js", text, NO_VALIDATION))
                .extracting(LiteralSpan::text)
                .containsExactly("query AQuery { id }");
    }

    @Test
    void regexWithSlashInClassAndFlagsIsSkipped() {
        String text = """
                function check(s) {
                  if (/[/"`]+/gi.test(s)) return /graphql`query X { a }`/;
                  return s;
                }
                const half = total / 2; const q = graphql`query AppQuery { id }`;
                """;

        assertThat(extract("App.js", text, NO_VALIDATION))
                .extracting(LiteralSpan::text)
                .containsExactly("query AppQuery { id }");
    }

    @Test
    void divisionIsNotMistakenForRegex() {
        String text = "const x = (a) / b; const y = c[0] / 2; const q = graphql`query AppQuery { id }`;";

        assertThat(extract("App.js", text, NO_VALIDATION)).hasSize(1);
    }

    @Test
    void tagInsideSubstitutionOfPlainTemplateIsExtracted() {
        String text = "x = `${graphql`query AQuery{id}`}`;\n"
                + "y = `a ${cond ? { k: graphql`query BQuery{id}` } : null} b`;";

        List<LiteralSpan> literals = extract("App.js", text, NO_VALIDATION);

        assertThat(literals).extracting(LiteralSpan::text)
                .containsExactly("query AQuery{id}", "query BQuery{id}");
        assertThat(literals.get(0).location().columnNumber()).isEqualTo(16);
        assertThat(literals.get(1).location().lineNumber()).isEqualTo(2);
        assertThat(literals.get(1).keyName()).isEqualTo("k");
    }
}
