package org.fastbuild.lsp.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.fastbuild.lsp.evaluator.diagnostics.EvaluatorLogger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Configures the logging system based on HOCON configuration.
 * This class reads logging settings from the configuration and applies them
 * to the Logback logging framework at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "INFO"  # Default log level for all loggers
 *   levels {
 *     # Specific logger levels - override the default for particular components
 *     "org.fastbuild.lsp.evaluator" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {}

    /**
     * Configures the logging system based on the provided configuration.
     * This method is idempotent - calling it multiple times has no additional effect.
     *
     * @param config The configuration containing logging settings.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            loggingConfigured = true;
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);
            alignEvaluatorLogger(context);

            loggingConfigured = true;
            LOGGER.debug("Logging configuration applied successfully.");

        } catch (final Exception e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
            loggingConfigured = true; // Prevent retry attempts
        }
    }

    /**
     * Configures the default log level for all loggers.
     */
    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final String levelStr = loggingConfig.getString(DEFAULT_LEVEL_KEY);
            final Level level = Level.toLevel(levelStr, Level.INFO);

            final Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
            rootLogger.setLevel(level);

            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    /**
     * Configures specific logger levels as defined in the configuration.
     */
    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            LOGGER.debug("No specific logger levels configured.");
            return;
        }

        final Config levelsConfig = loggingConfig.getConfig(LEVELS_KEY);
        int configuredCount = 0;

        for (final Map.Entry<String, ConfigValue> entry : levelsConfig.root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();

            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'.", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }

        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Skips the string building of {@link EvaluatorLogger} calls that Logback would drop anyway.
     */
    private static void alignEvaluatorLogger(final LoggerContext context) {
        final Level effective = context.getLogger(EvaluatorLogger.class).getEffectiveLevel();
        if (effective.isGreaterOrEqual(Level.ERROR)) {
            EvaluatorLogger.setLevel(EvaluatorLogger.ERROR);
        } else if (effective.isGreaterOrEqual(Level.WARN)) {
            EvaluatorLogger.setLevel(EvaluatorLogger.WARN);
        } else if (effective.isGreaterOrEqual(Level.INFO)) {
            EvaluatorLogger.setLevel(EvaluatorLogger.INFO);
        } else if (effective.isGreaterOrEqual(Level.DEBUG)) {
            EvaluatorLogger.setLevel(EvaluatorLogger.DEBUG);
        } else {
            EvaluatorLogger.setLevel(EvaluatorLogger.TRACE);
        }
    }

    /**
     * Resets the logging configuration state. This is primarily useful for testing.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
