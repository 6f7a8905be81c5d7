package org.embedql.compiler.frontend.extract;

import org.embedql.compiler.api.SourceInfo;
import org.embedql.compiler.diagnostics.ExtractionException;
import org.embedql.compiler.frontend.parser.ast.DefinitionKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class ModuleNamesTest {

    private static LiteralSpan literal(String text, String keyName) {
        return new LiteralSpan(text, new SourceInfo("src/App.js", 3, 20), keyName);
    }

    @Test
    void scriptModuleNameStripsExtensionsAndCamelizes() {
        assertThat(ModuleNames.scriptModuleName("src/App.js")).isEqualTo("App");
        assertThat(ModuleNames.scriptModuleName("components/user-profile.react.js")).isEqualTo("userProfile");
        assertThat(ModuleNames.scriptModuleName("Button/index.js")).isEqualTo("Button");
        assertThat(ModuleNames.scriptModuleName("src\\Feed_item.tsx")).isEqualTo("FeedItem");
    }

    @Test
    void platformSuffixesAreKept() {
        assertThat(ModuleNames.scriptModuleName("Header.ios.js")).isEqualTo("HeaderIos");
    }

    @Test
    void javaModuleNameIsTheFileName() {
        assertThat(ModuleNames.javaModuleName("src/main/java/com/acme/UserQueries.java")).isEqualTo("UserQueries");
    }

    @Test
    void validNamesPass() {
        assertThatCode(() -> ModuleNames.validate(literal("""
                query AppQuery { viewer { id } }
                mutation AppRenameMutation { rename { id } }
                fragment AppUser on User { id }
                """, null), "App")).doesNotThrowAnyException();
    }

    @Test
    void suffixIsNotTiedToOperationKind() {
        assertThatCode(() -> ModuleNames.validate(literal("mutation AppQuery { x }", null), "App"))
                .doesNotThrowAnyException();
    }

    @Test
    void operationWithoutModulePrefixIsRejected() {
        assertThatThrownBy(() -> ModuleNames.validate(literal("query FeedQuery { id }", null), "App"))
                .isInstanceOf(ExtractionException.class)
                .hasMessage("src/App.js:3:20: Operation names in graphql tags must be prefixed with the module "
                        + "name and end in \"Mutation\", \"Query\", or \"Subscription\". Got `FeedQuery` in module `App`.");
    }

    @Test
    void operationWithoutSuffixIsRejected() {
        assertThatThrownBy(() -> ModuleNames.validate(literal("query AppData { id }", null), "App"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Got `AppData`");
    }

    @Test
    void anonymousOperationIsRejected() {
        assertThatThrownBy(() -> ModuleNames.validate(literal("{ viewer { id } }", null), "App"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("In module `App`, an operation requires a name.");
    }

    @Test
    void fragmentWithoutModulePrefixIsRejected() {
        assertThatThrownBy(() -> ModuleNames.validate(literal("fragment UserFields on User { id }", null), "App"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Fragment names in graphql tags must be prefixed with the module name.");
    }

    @Test
    void containerFragmentMustMatchKeyName() {
        assertThatCode(() -> ModuleNames.validate(literal("fragment App_user on User { id }", "user"), "App"))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> ModuleNames.validate(literal("fragment AppUser on User { id }", "user"), "App"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Got `AppUser`, expected `App_user`.");
    }

    @Test
    void moduleNameMustBeAnIdentifier() {
        assertThatThrownBy(() -> ModuleNames.validate(literal("query AppQuery { id }", null), "1app"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Expected the module name to be a valid identifier, got `1app`.");
    }

    @Test
    void headerScanIgnoresNestedNamesAndStrings() {
        assertThat(ModuleNames.scanHeaders("""
                query AppQuery($q: String = "query Fake") @live { search(q: $q) { fragment } }
                # fragment Commented on User
                fragment AppItem on Item { id }
                """)).containsExactly(
                new ModuleNames.Header(DefinitionKind.QUERY, "AppQuery"),
                new ModuleNames.Header(DefinitionKind.FRAGMENT, "AppItem"));
    }
}
