package com.jctaxes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for classes that load configuration from a properties file.
 *
 * Every key in the file can be overridden by an environment variable or a system property carrying the prefix
 * "jctaxes", e.g. JCTAXES_MERGE_BUFFER_FT=40 or java -Djctaxes.merge.buffer.ft=40. Precedence of configuration
 * sources is: system properties > environment variables > config file.
 *
 * Problems are collected rather than thrown one at a time, so an operator sees every missing or malformed key after
 * a single attempt.
 */
public class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String PROPERTY_PREFIX = "jctaxes-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    protected ConfigBase (Properties properties) {
        this(properties, System.getenv(), System.getProperties());
    }

    /** Allows the override sources to be supplied explicitly, so tests do not depend on the real environment. */
    protected ConfigBase (Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties) {
        this.properties = properties;
        // Overwrite properties from the config file one by one, so that each potentially confusing change is logged.
        setPropertiesFromMap(environment, "environment variable");
        setPropertiesFromMap(systemProperties, "system properties");
    }

    /** Load a properties file, wrapping any failure so that callers need not handle checked exceptions. */
    protected static Properties propsFromFile (String filename) {
        try (Reader propsReader = new FileReader(filename)) {
            Properties properties = new Properties();
            properties.load(propsReader);
            return properties;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load configuration properties from " + filename, e);
        }
    }

    // Always use the following *Prop methods to read properties. They record missing keys and parse errors,
    // allowing config loading to continue and report as many problems as possible at once.

    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value;
    }

    /** @return the value, or null if the key is absent. Absence of an optional key is not an error. */
    protected String optionalStrProp (String key) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    /** A numeric option with a fallback. Present but unparseable values are still errors. */
    protected double doubleProp (String key, double defaultValue) {
        String val = optionalStrProp(key);
        if (val == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(val);
        } catch (NumberFormatException nfe) {
            LOG.error("Value of configuration option '{}' could not be parsed as a number: {}", key, val);
            keysWithErrors.add(key);
            return defaultValue;
        }
    }

    /**
     * Call this after reading all properties to enforce the presence and validity of all configuration options.
     * @throws IllegalArgumentException naming every offending key.
     */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            String keys = String.join(", ", keysWithErrors);
            LOG.error("You must provide valid values for these configuration properties: {}", keys);
            throw new IllegalArgumentException("Missing or invalid configuration properties: " + keys);
        }
    }

    /**
     * Overwrite options from the config file with environment variables and system properties. Keys are normalized
     * to lower case with dash separators, so that both properties and environment variable conventions work.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = ((String) entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = ((String) entry.getValue());
            if (key.startsWith(PROPERTY_PREFIX)) {
                key = key.substring(PROPERTY_PREFIX.length());
                String existingKey = properties.getProperty(key);
                if (existingKey != null) {
                    LOG.info("Overwriting existing config key {} to '{}' from {}.", key, value, sourceDescription);
                } else {
                    LOG.info("Setting configuration key {} to '{}' from {}.", key, value, sourceDescription);
                }
                properties.setProperty(key, value);
            }
        }
    }

}
