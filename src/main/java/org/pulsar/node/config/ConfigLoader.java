package org.pulsar.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "pulsar.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. CLI Arguments (as Java System Properties, e.g., -Dkey=value)
     * 3. Configuration File (pulsar.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return merge(fileConfig);
    }

    /**
     * Loads the configuration with an explicit file as the file layer.
     *
     * @param configFile The configuration file, must exist.
     * @return A resolved {@link Config}.
     * @throws IllegalArgumentException if the file does not exist.
     */
    public static Config load(final File configFile) {
        if (!configFile.exists() || configFile.isDirectory()) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
        }
        LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
        return merge(ConfigFactory.parseFile(configFile));
    }

    /**
     * Loads the configuration with a classpath resource as the file layer. Used by tests.
     *
     * @param resourceName Classpath resource name of the configuration file.
     * @return A resolved {@link Config}.
     */
    public static Config load(final String resourceName) {
        return merge(ConfigFactory.parseResources(resourceName));
    }

    private static Config merge(final Config fileConfig) {
        // 1. Environment Variables (highest precedence).
        final Config envConfig = ConfigFactory.systemEnvironment();

        // 2. CLI arguments passed as -Dkey=value system properties.
        final Config cliConfig = ConfigFactory.systemProperties();

        // 4. Default values from reference.conf in the classpath (lowest precedence).
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // Chain the configs together. The one provided first wins.
        return envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
