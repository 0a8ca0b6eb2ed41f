package com.conveyal.roofarea;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Shared functionality for classes that load properties containing configuration information.
 *
 * Values come from a properties file layered over built-in defaults, then environment variables and system properties,
 * then any explicit overrides such as command line flags. In environment variables and system properties the keys
 * may be in upper or lower case and use dashes, underscores, or dots as separators, and must be prefixed with
 * "roof-area", e.g. ROOF_AREA_THRESHOLD=0.6 or java -Droof-area.tile-size=256.
 * Precedence is: explicit overrides > system properties > environment variables > config file > defaults.
 */
public abstract class ConfigBase {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigBase.class);

    public static final String PROPERTY_PREFIX = "roof-area-";

    // All access to these should be through the *Prop methods.
    private final Properties properties;

    protected final Set<String> keysWithErrors = new TreeSet<>();

    /**
     * Prepare to load config from the given properties, overriding them from the supplied environment variables and
     * system properties. Passing these maps in rather than reading them here keeps the class usable in tests.
     */
    protected ConfigBase (Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties) {
        this.properties = properties;
        // Overwrite properties from config file with environment variables and system properties.
        // This could also be done with the Properties constructor that specifies defaults, but by manually
        // overwriting items we are able to log these potentially confusing changes to configuration.
        setPropertiesFromMap(environment, "environment variable");
        setPropertiesFromMap(systemProperties, "system properties");
    }

    /** Load properties from a classpath resource, returning empty properties if the resource does not exist. */
    protected static Properties propsFromResource (String resourceName) {
        Properties properties = new Properties();
        try (InputStream stream = ConfigBase.class.getResourceAsStream(resourceName)) {
            if (stream != null) {
                properties.load(stream);
            }
        } catch (Exception e) {
            throw new RoofAreaException(RoofAreaException.Type.CONFIGURATION,
                    "Could not load default configuration properties.", e);
        }
        return properties;
    }

    /** Load a properties file on top of the supplied defaults. */
    protected static Properties propsFromFile (Path file, Properties defaults) {
        Properties properties = new Properties();
        properties.putAll(defaults);
        try (Reader propsReader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(propsReader);
            return properties;
        } catch (Exception e) {
            throw new RoofAreaException(RoofAreaException.Type.CONFIGURATION,
                    "Could not load configuration properties from " + file, e);
        }
    }

    // Always use the following *Prop methods to read properties. This will catch and log missing keys or parse
    // exceptions, allowing config loading to continue and reporting as many problems as possible at once.

    // Catches and records missing values,
    // so methods that wrap this and parse into non-String types can just ignore null values.
    protected String strProp (String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            LOG.error("Missing configuration option {}", key);
            keysWithErrors.add(key);
        }
        return value == null ? null : value.trim();
    }

    protected int intProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                return Integer.parseInt(val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as an integer: {}", key, val);
                keysWithErrors.add(key);
            }
        }
        return 0;
    }

    protected double doubleProp (String key) {
        String val = strProp(key);
        if (val != null) {
            try {
                double parsed = Double.parseDouble(val);
                if (Double.isFinite(parsed)) {
                    return parsed;
                }
                LOG.error("Value of configuration option '{}' is not a finite number: {}", key, val);
            } catch (NumberFormatException nfe) {
                LOG.error("Value of configuration option '{}' could not be parsed as a number: {}", key, val);
            }
            keysWithErrors.add(key);
        }
        return 0;
    }

    /** Record an error on a value that parsed correctly but is out of its allowed range. */
    protected void checkRange (String key, boolean valid, String requirement) {
        if (!valid) {
            LOG.error("Value of configuration option '{}' must be {}.", key, requirement);
            keysWithErrors.add(key);
        }
    }

    /**
     * Apply overrides with unprefixed keys (already in config file form) after all other sources, so they take
     * precedence over everything else. Null values are skipped, leaving the existing value in place.
     */
    protected void overrideProperties (Map<String, String> overrides, String sourceDescription) {
        for (Map.Entry<String, String> entry : overrides.entrySet()) {
            if (entry.getValue() == null) continue;
            LOG.debug("Setting configuration key {} to '{}' from {}.", entry.getKey(), entry.getValue(), sourceDescription);
            properties.setProperty(entry.getKey(), entry.getValue());
        }
    }

    /** Call this after reading all properties to enforce the presence and validity of all configuration options. */
    protected void throwIfErrors () {
        if (!keysWithErrors.isEmpty()) {
            throw RoofAreaException.configuration(
                    "Missing or invalid configuration properties: " + String.join(", ", keysWithErrors));
        }
    }

    /**
     * Overwrite configuration options supplied in the config file with environment variables and system properties
     * (e.g. supplied on the JVM command line). Case and separators are normalized to conform to both properties and
     * environment variable conventions. Properties are Object-Object Maps so key and value are cast to String.
     */
    private void setPropertiesFromMap (Map<?, ?> map, String sourceDescription) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Normalize to String type, all lower case, all dash separators.
            String key = ((String)entry.getKey()).toLowerCase().replaceAll("[\\._-]", "-");
            String value = ((String)entry.getValue());
            if (key.startsWith(PROPERTY_PREFIX)) {
                // Strip off prefix to get the key that would be used in our config file.
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
