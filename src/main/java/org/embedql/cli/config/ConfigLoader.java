package org.embedql.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;

/**
 * Central configuration loader for the command line.
 * <p>
 * Composes HOCON configuration from multiple sources with the following precedence
 * (highest to lowest):
 * <ol>
 *   <li>Java system properties ({@code -Dembedql.parser.extractor=java})</li>
 *   <li>Environment variables</li>
 *   <li>User configuration file ({@code config/embedql.conf})</li>
 *   <li>Default reference configuration ({@code reference.conf} on the classpath)</li>
 * </ol>
 * <p>
 * Substitutions are resolved only after all layers are composed, so a user override of a
 * value also reaches every substitution in {@code reference.conf} that refers to it.
 *
 * @see #resolve(File, ConfigMessageHandler) for the config file discovery cascade
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "embedql.conf";

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        /** Which config file was selected. */
        INFO,
        /** Fallback to classpath defaults. */
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being located. The command
     * line routes these to SLF4J before logging is fully configured.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Resolves configuration by taking the first configuration file found in this order:
     * <ol>
     *   <li><strong>Explicit file:</strong> the {@code --config} option</li>
     *   <li><strong>System property:</strong> {@code -Dconfig.file}</li>
     *   <li><strong>Working directory:</strong> {@code config/embedql.conf}</li>
     *   <li><strong>Installation directory:</strong> {@code APP_HOME/config/embedql.conf}
     *       next to the {@code lib/} directory holding the running jar</li>
     *   <li><strong>Classpath defaults:</strong> {@code reference.conf} only</li>
     * </ol>
     * System properties and environment variables override the selected file in every case.
     *
     * @param explicitConfigFile config file from the CLI option, or {@code null} for auto-discovery.
     * @param handler            callback for resolution progress messages.
     * @return the fully resolved application {@link Config}.
     * @throws IllegalArgumentException            if an explicitly specified config file
     *                                              (via parameter or {@code -Dconfig.file}) does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            return loadRequired(explicitConfigFile, "--config", handler);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return loadRequired(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file", handler);
        }

        final File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.isFile()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file from working directory: " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        final File installationFile = detectInstallationConfigFile();
        if (installationFile != null) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file from installation directory: " + installationFile.getAbsolutePath());
            return loadFromFile(installationFile);
        }

        handler.log(MessageLevel.WARN,
                "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME + "' found, using default configuration from classpath.");
        return loadDefaults();
    }

    private static Config loadRequired(final File file, final String origin, final ConfigMessageHandler handler) {
        if (!file.exists()) {
            throw new IllegalArgumentException(
                    "Configuration file specified via " + origin + " not found: " + file.getAbsolutePath());
        }
        handler.log(MessageLevel.INFO, "Using configuration file specified via " + origin + ": " + file.getAbsolutePath());
        return loadFromFile(file);
    }

    /**
     * Loads configuration from a file, merged with classpath defaults.
     *
     * @param configFile the configuration file to load.
     * @return the fully resolved application {@link Config}.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads configuration from classpath defaults only.
     *
     * @return the fully resolved application {@link Config}.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Infers {@code APP_HOME} from the running jar ({@code APP_HOME/lib/embedql-*.jar}) and
     * returns {@code APP_HOME/config/embedql.conf} if it exists. When running from
     * {@code target/classes} there is no installation directory.
     *
     * @return the configuration file, or {@code null} if there is none.
     */
    private static File detectInstallationConfigFile() {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return null;
        }
        try {
            final URL location = codeSource.getLocation();
            final File jar = new File(location.toURI());
            if (!jar.isFile() || jar.getParentFile() == null || jar.getParentFile().getParentFile() == null) {
                return null;
            }
            final File configFile = new File(new File(jar.getParentFile().getParentFile(), CONFIG_DIR), CONFIG_FILE_NAME);
            return configFile.isFile() ? configFile : null;
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Could not determine installation directory: {}", e.getMessage());
            return null;
        }
    }
}
