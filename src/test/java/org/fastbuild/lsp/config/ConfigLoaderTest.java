package org.fastbuild.lsp.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.fastbuild.lsp.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. Environment Variables (highest priority)
 * 2. System Properties
 * 3. Configuration File
 * 4. Default reference configuration (lowest priority)
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        // Invalidate the cache before each test to ensure a clean slate
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("evaluator.max-scope-depth");
        System.clearProperty("evaluator.platform");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String contents) throws IOException {
        return Files.writeString(tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME), contents).toFile();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when the file is missing")
    void load_shouldUseDefaultsWhenFileMissing() {
        // Act
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        // Assert
        assertNotNull(config);
        assertEquals(128, config.getInt("evaluator.max-scope-depth"));
        assertEquals("", config.getString("evaluator.root-file"));
        assertEquals("INFO", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("Configuration file should override reference defaults")
    void load_fileShouldOverrideDefaults() throws IOException {
        // Arrange
        File file = writeConfig("evaluator { max-scope-depth = 7, platform = osx }");

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals(7, config.getInt("evaluator.max-scope-depth"));
        assertEquals("osx", config.getString("evaluator.platform"));
        // Values not in the file still come from reference.conf
        assertFalse(config.getBoolean("evaluator.log-performance-metrics"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFile() throws IOException {
        // Arrange
        File file = writeConfig("evaluator { max-scope-depth = 7, platform = osx }");
        System.setProperty("evaluator.max-scope-depth", "9");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals(9, config.getInt("evaluator.max-scope-depth"));
        assertEquals("osx", config.getString("evaluator.platform"));
    }

    @Test
    @DisplayName("A directory in place of the file is skipped")
    void load_shouldSkipDirectory() {
        // Act
        Config config = ConfigLoader.load(tempDir.toFile());

        // Assert
        assertEquals(128, config.getInt("evaluator.max-scope-depth"));
    }

    @Test
    @DisplayName("Substitutions in the file are resolved")
    void load_shouldResolveSubstitutions() throws IOException {
        // Arrange
        File file = writeConfig(String.join("\n",
                "depth = 42",
                "evaluator.max-scope-depth = ${depth}"));

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals(42, config.getInt("evaluator.max-scope-depth"));
    }
}
