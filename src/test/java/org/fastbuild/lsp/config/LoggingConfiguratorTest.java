package org.fastbuild.lsp.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.fastbuild.lsp.evaluator.diagnostics.EvaluatorLogger;
import org.fastbuild.lsp.junit.extensions.logging.AllowLog;
import org.fastbuild.lsp.junit.extensions.logging.LogLevel;
import org.fastbuild.lsp.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String EVALUATOR_LOGGER = "org.fastbuild.lsp.evaluator";
    private static final String CUSTOM_LOGGER = "org.fastbuild.lsp.test.Custom";

    private LoggerContext context;
    private Level rootLevelBefore;
    private Level evaluatorLevelBefore;
    private int evaluatorLoggerLevelBefore;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        rootLevelBefore = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        evaluatorLevelBefore = context.getLogger(EVALUATOR_LOGGER).getLevel();
        evaluatorLoggerLevelBefore = EvaluatorLogger.getLevel();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevelBefore);
        context.getLogger(EVALUATOR_LOGGER).setLevel(evaluatorLevelBefore);
        context.getLogger(CUSTOM_LOGGER).setLevel(null);
        EvaluatorLogger.setLevel(evaluatorLoggerLevelBefore);
    }

    @Test
    void configure_withDefaultLevel_shouldSetRootLevel() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withSpecificLevels_shouldSetLoggerLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "WARN"
              levels {
                "org.fastbuild.lsp.test.Custom" = "TRACE"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.WARN, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.TRACE, context.getLogger(CUSTOM_LOGGER).getLevel());
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Ignoring unknown level 'LOUD' for logger '.*'\\.")
    void configure_withUnknownLevel_shouldWarnAndContinue() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              levels {
                "org.fastbuild.lsp.test.Custom" = "LOUD"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertNull(context.getLogger(CUSTOM_LOGGER).getLevel(), "An unknown level must not be applied");
    }

    @Test
    void configure_isIdempotent() {
        // Given
        final Config first = ConfigFactory.parseString("logging.default-level = \"ERROR\"");
        final Config second = ConfigFactory.parseString("logging.default-level = \"DEBUG\"");

        // When
        LoggingConfigurator.configure(first);
        LoggingConfigurator.configure(second);

        // Then
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_shouldAlignEvaluatorLogger() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              levels {
                "org.fastbuild.lsp.evaluator" = "WARN"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(EvaluatorLogger.WARN, EvaluatorLogger.getLevel());
    }

    @Test
    void configure_withoutLoggingSection_shouldKeepLevels() {
        // Given
        final Level before = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

        // When
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Then
        assertEquals(before, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(evaluatorLoggerLevelBefore, EvaluatorLogger.getLevel());
    }
}
