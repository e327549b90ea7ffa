package org.tinyasm.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
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
    static final String CONFIG_FILE_NAME = "tinyasm.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with {@code tinyasm.conf} from the working directory as file source.
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment variables ({@code CONFIG_FORCE_tinyasm_lowering_workers=4})
     * 2. Java system properties ({@code -Dtinyasm.lowering.workers=4})
     * 3. Configuration file (the given file, else tinyasm.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A configuration file given on the command line, or null.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws ConfigException if a file cannot be parsed or the explicit file is missing.
     */
    public static Config load(File explicitFile) {
        final Config envConfig = ConfigFactory.systemEnvironmentOverrides();
        final Config cliConfig = ConfigFactory.systemProperties();

        final File configFile = explicitFile != null ? explicitFile : new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else if (explicitFile != null) {
            throw new ConfigException.IO(null, "Configuration file not found: " + explicitFile.getAbsolutePath());
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.defaultReference();

        // The one provided first wins.
        return envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
