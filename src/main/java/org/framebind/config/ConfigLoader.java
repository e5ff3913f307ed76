package org.framebind.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the library configuration from various sources.
 * The loader respects a specific precedence order so hosts can override engine settings
 * without rebuilding.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "framebind.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. System properties (e.g., -Dframebind.engine.strict-queries=true)
     * 2. Environment variables
     * 3. Configuration file (framebind.conf in the working directory)
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
     * Loads the configuration with a classpath resource in place of the working-directory file.
     *
     * @param resourceName Classpath resource to use as the file layer, e.g. {@code "org/framebind/config/test-config.conf"}.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final String resourceName) {
        LOG.debug("Loading configuration from classpath resource: {}", resourceName);
        return merge(ConfigFactory.parseResources(resourceName));
    }

    private static Config merge(final Config fileConfig) {
        final Config cliConfig = ConfigFactory.systemProperties();
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return cliConfig
            .withFallback(envConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
