package org.bifgen.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the generator configuration. The loader respects a fixed
 * precedence order:
 * <ol>
 *   <li>Java system properties ({@code -Dbifgen.target-prefix=...})</li>
 *   <li>The file given with {@code --config}</li>
 *   <li>Default values from {@code reference.conf} on the classpath</li>
 * </ol>
 * Environment variables are not consulted: the output must depend only on the inputs.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration.
     *
     * @param configFile An optional configuration file, may be null.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws ConfigException if the file is missing or cannot be parsed.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new ConfigException.Generic("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            fileConfig = ConfigFactory.empty();
        }

        return ConfigFactory.systemProperties()
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }
}
