package org.minic.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the front end configuration from its layered sources.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "minic.conf";

    private ConfigLoader() {}

    /**
     * Loads the configuration from the working directory, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (-Dkey=value)
     * 3. Configuration File (minic.conf in the working directory)
     * 4. Default values (reference.conf on the classpath)
     *
     * @return A resolved {@link Config}.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration with an explicit file for layer 3.
     *
     * @param configFile The configuration file; skipped if it does not exist.
     * @return A resolved {@link Config}.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        return envConfig
            .withFallback(propertiesConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    /**
     * Loads the configuration and turns it into ready-to-use settings.
     * Also applies the {@code logging} section to Logback.
     *
     * @return The compiler settings.
     */
    public static CompilerSettings loadSettings() {
        final Config config = load();
        LoggingConfigurator.configure(config);
        final CompilerSettings settings = CompilerSettings.fromConfig(config);
        settings.apply();
        return settings;
    }
}
