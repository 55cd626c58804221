package org.taml.config;

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
    static final String CONFIG_FILE_NAME = "taml.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration using {@value #CONFIG_FILE_NAME} from the working directory, if present.
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment variable overrides (CONFIG_FORCE_taml_parser_max__depth=50)
     * 2. Java system properties (-Dtaml.parser.max-depth=50)
     * 3. Configuration file (the given file, or taml.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicit configuration file, or null to look for {@value #CONFIG_FILE_NAME}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if an explicit file does not exist.
     */
    public static Config load(File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironmentOverrides();
        final Config cliConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Using configuration file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            final File defaultFile = new File(CONFIG_FILE_NAME);
            if (defaultFile.isFile()) {
                LOG.info("Loading configuration from file: {}", defaultFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(defaultFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Skipping file-based configuration.", defaultFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
                .withFallback(cliConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}
