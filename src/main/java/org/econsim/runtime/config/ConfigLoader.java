package org.econsim.runtime.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the simulation configuration from layered sources.
 * Sources given first win: system properties, then the configuration file, then {@code reference.conf}.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "econsim.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads {@value #CONFIG_FILE_NAME} from the working directory, with the usual fallbacks.
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Java system properties (e.g. {@code -Deconsim.seed=7})
     * 2. The given configuration file, if it exists
     * 3. Default values from {@code reference.conf} on the classpath
     *
     * @param configFile The HOCON file to read; skipped if missing.
     * @return A resolved {@link Config} holding the merged configuration.
     */
    public static Config load(final File configFile) {
        final Config cliConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.info("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return cliConfig
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    /**
     * Parses a HOCON string on top of {@code reference.conf}. Used for embedded scenarios.
     * @param hocon The configuration text.
     * @return The resolved configuration.
     */
    public static Config parse(final String hocon) {
        return ConfigFactory.parseString(hocon)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}
