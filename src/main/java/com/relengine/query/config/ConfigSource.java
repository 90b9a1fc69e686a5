package com.relengine.query.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Layered parameter lookup: command line first, then JVM system properties,
 * then the {@code .env} file of the working directory.
 */
public class ConfigSource {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigSource.class);

    private static final String ENV_FILE = ".env";

    private final CommandLineOptions options;
    private final Properties properties;

    public ConfigSource(CommandLineOptions options) {
        this(options, Paths.get(ENV_FILE));
    }

    public ConfigSource(CommandLineOptions options, Path envFile) {
        this.options = options;
        this.properties = new Properties();
        loadConfiguration(envFile);
    }

    private void loadConfiguration(Path envFile) {
        if (!Files.exists(envFile)) {
            return;
        }
        try (InputStream in = Files.newInputStream(envFile)) {
            properties.load(in);
            LOG.debug("Loaded {} properties from {}", properties.size(), envFile);
        } catch (IOException e) {
            // the file is optional, command line and system properties still apply
            LOG.warn("Could not read {}, ignoring it: {}", envFile, e.getMessage());
        }
    }

    /**
     * Returns the value of a parameter, or {@code defaultValue} when no layer sets it.
     */
    public String getProperty(String key, String defaultValue) {
        String value = options.get(key);
        if (value != null) {
            return value;
        }
        return System.getProperty(key, properties.getProperty(key, defaultValue));
    }

    public String getProperty(String key) {
        return getProperty(key, null);
    }
}
