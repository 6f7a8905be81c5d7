package org.embedql.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * system properties, then the configuration file, then {@code reference.conf}.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("embedql.build.parallelism");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should merge the file with reference defaults")
    void loadFromFile_shouldMergeFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals("java", config.getString("embedql.parser.extractor"));
        assertTrue(config.getBoolean("embedql.parser.validate-names"));
        assertEquals(10000, config.getInt("embedql.extraction-cache.maximum-size"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
    }

    @Test
    @DisplayName("loadDefaults should expose reference.conf values")
    void loadDefaults_shouldExposeReferenceValues() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals("javascript", config.getString("embedql.parser.extractor"));
        assertEquals(List.of(".js", ".jsx", ".ts", ".tsx", ".java"), config.getStringList("embedql.parser.extensions"));
        assertEquals(4, config.getInt("embedql.build.parallelism"));
        assertEquals("INFO", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("System property should override reference defaults")
    void loadDefaults_systemPropertyShouldOverrideDefaults() {
        System.setProperty("embedql.build.parallelism", "9");
        ConfigFactory.invalidateCaches();

        assertEquals(9, ConfigLoader.loadDefaults().getInt("embedql.build.parallelism"));
    }

    @Test
    @DisplayName("resolve should use the explicit file and report it")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                (level, message) -> messages.add(level + " " + message));

        assertEquals("java", config.getString("embedql.parser.extractor"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file specified via --config"));
    }

    @Test
    @DisplayName("resolve should reject a missing explicit file")
    void resolve_shouldRejectMissingExplicitFile(@TempDir Path tempDir) {
        File missing = tempDir.resolve("missing.conf").toFile();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("missing.conf"));
    }

    @Test
    @DisplayName("resolve should honour -Dconfig.file")
    void resolve_shouldUseConfigFileProperty(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "embedql.build.parallelism = 2\n");
        System.setProperty("config.file", file.toString());
        ConfigFactory.invalidateCaches();
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(null, (level, message) -> messages.add(message));

        assertEquals(2, config.getInt("embedql.build.parallelism"));
        assertTrue(messages.get(0).contains("-Dconfig.file"));
    }

    private static File testResource(String name) {
        URL url = ConfigLoaderTest.class.getClassLoader().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
