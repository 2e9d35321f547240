package org.fastbuild.lsp.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the evaluator configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "fbuild-evaluator.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with {@value #CONFIG_FILE_NAME} from the working directory as the file
     * layer.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (-Dkey=value)
     * 3. Configuration File
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile The configuration file. A missing file is skipped.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final File configFile) {
        // 1. Environment Variables (highest precedence).
        final Config envConfig = ConfigFactory.systemEnvironment();

        // 2. System properties.
        final Config cliConfig = ConfigFactory.systemProperties();

        // 3. Configuration file from the filesystem.
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        // 4. Default values from reference.conf in the classpath (lowest precedence).
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        final Config combinedConfig = envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }
}
