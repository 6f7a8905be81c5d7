package org.embedql.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the log levels of the {@code logging} configuration block to Logback:
 * <pre>
 *   logging {
 *     default-level = "INFO"
 *     levels {
 *       "org.embedql.compiler.frontend.cache" = "DEBUG"
 *     }
 *   }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    /**
     * @param config The application configuration. Missing keys leave Logback unchanged.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            log.warn("Logback is not the active SLF4J binding, ignoring logging configuration");
            return;
        }

        if (config.hasPath("logging.default-level")) {
            Level level = Level.toLevel(config.getString("logging.default-level"), Level.INFO);
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(level);
        }

        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                // keys are quoted in HOCON because logger names contain dots
                String loggerName = entry.getKey();
                String levelName = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(loggerName).setLevel(Level.toLevel(levelName, Level.INFO));
            }
        }
    }
}
