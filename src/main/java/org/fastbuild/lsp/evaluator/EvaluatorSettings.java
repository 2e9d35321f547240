package org.fastbuild.lsp.evaluator;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.fastbuild.lsp.evaluator.preprocessor.Platform;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * The validated settings of the {@code evaluator} configuration section.
 */
public final class EvaluatorSettings {

    /** The configuration section these settings are read from. */
    public static final String CONFIG_PATH = "evaluator";

    /** The user-function recursion cap used when nothing is configured. */
    public static final int DEFAULT_MAX_SCOPE_DEPTH = 128;

    private final Path rootFile;
    private final int maxScopeDepth;
    private final boolean logPerformanceMetrics;
    private final Platform platform;

    public EvaluatorSettings(Path rootFile, int maxScopeDepth, boolean logPerformanceMetrics, Platform platform) {
        this.rootFile = rootFile;
        this.maxScopeDepth = maxScopeDepth;
        this.logPerformanceMetrics = logPerformanceMetrics;
        this.platform = platform;
    }

    /**
     * @return Settings with every value at its default and the host platform.
     */
    public static EvaluatorSettings defaults() {
        return new EvaluatorSettings(null, DEFAULT_MAX_SCOPE_DEPTH, false, Platform.current());
    }

    /**
     * Reads and validates the {@code evaluator} section.
     * @param config The resolved configuration.
     * @return The settings.
     * @throws SettingsException if a value is invalid.
     */
    public static EvaluatorSettings fromConfig(Config config) {
        try {
            Config section = config.getConfig(CONFIG_PATH);
            Path rootFile = parseRootFile(section.getString("root-file"));

            int maxScopeDepth = section.getInt("max-scope-depth");
            if (maxScopeDepth < 1) {
                throw new SettingsException("The \"Max Scope Depth\" setting must be at least 1, but is " + maxScopeDepth + ".");
            }

            String platformName = section.getString("platform");
            Platform platform;
            if (platformName.isBlank()) {
                platform = Platform.current();
            } else {
                try {
                    platform = Platform.fromName(platformName);
                } catch (IllegalArgumentException e) {
                    throw new SettingsException("The \"Platform\" setting is set to \"" + platformName
                            + "\", which is not one of windows, osx or linux.", e);
                }
            }

            return new EvaluatorSettings(rootFile, maxScopeDepth, section.getBoolean("log-performance-metrics"), platform);
        } catch (ConfigException e) {
            throw new SettingsException("Invalid evaluator configuration: " + e.getMessage(), e);
        }
    }

    private static Path parseRootFile(String value) {
        if (value.isEmpty()) {
            return null;
        }
        Path path;
        try {
            path = Path.of(value);
        } catch (InvalidPathException e) {
            throw new SettingsException("The \"Root File\" setting is set to \"" + value + "\", which is not an absolute file path.", e);
        }
        if (!path.isAbsolute()) {
            throw new SettingsException("The \"Root File\" setting is set to \"" + value + "\", which is not an absolute file path.");
        }
        if (!Files.exists(path)) {
            throw new SettingsException("The \"Root File\" setting is set to \"" + value + "\", which does not exist.");
        }
        if (!Files.isRegularFile(path)) {
            throw new SettingsException("The \"Root File\" setting is set to \"" + value + "\", which is not a file.");
        }
        return path;
    }

    /**
     * @return The configured root file, or empty to evaluate the requested file as its own root.
     */
    public Optional<Path> getRootFile() {
        return Optional.ofNullable(rootFile);
    }

    public int getMaxScopeDepth() {
        return maxScopeDepth;
    }

    public boolean isLogPerformanceMetrics() {
        return logPerformanceMetrics;
    }

    public Platform getPlatform() {
        return platform;
    }
}
