package com.conveyal.roofarea;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Settings shared by all roof area commands. Defaults are shipped in the roof-area.properties resource so it's easy
 * to see an exhaustive list of all parameters; every value can be overridden from a config file, the environment,
 * system properties or the command line (see ConfigBase for precedence).
 */
public class RoofAreaConfig extends ConfigBase {

    public static final String DEFAULTS_RESOURCE = "/roof-area.properties";

    private static final List<String> LOG_LEVELS = List.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    // INSTANCE FIELDS

    private final double threshold;
    private final int    tileSize;
    private final int    overlap;
    private final double minAreaM2;
    private final long   seed;
    private final String logLevel;

    // CONSTRUCTORS

    protected RoofAreaConfig (Properties props, Map<?, ?> environment, Map<?, ?> systemProperties,
                              Map<String, String> overrides) {
        super(props, environment, systemProperties);
        overrideProperties(overrides, "command line");
        threshold = doubleProp("threshold");
        tileSize = intProp("tile-size");
        overlap = intProp("overlap");
        minAreaM2 = doubleProp("min-area-m2");
        seed = intProp("seed");
        String level = strProp("log-level");
        logLevel = level == null ? null : level.toUpperCase();
        checkRange("threshold", threshold >= 0 && threshold <= 1, "between 0 and 1");
        checkRange("tile-size", tileSize >= 64, "at least 64 pixels");
        checkRange("overlap", overlap >= 0, "zero or more pixels");
        checkRange("min-area-m2", minAreaM2 >= 0, "zero or more square meters");
        checkRange("log-level", logLevel == null || LOG_LEVELS.contains(logLevel), "one of " + LOG_LEVELS);
        throwIfErrors();
    }

    /** Built-in defaults, overridden by the process environment and system properties. */
    public static RoofAreaConfig load () {
        return load(null, Collections.emptyMap());
    }

    /**
     * @param configFile an optional properties file layered over the built-in defaults, may be null.
     * @param overrides values with config file keys (e.g. "tile-size") taking precedence over all other sources.
     */
    public static RoofAreaConfig load (Path configFile, Map<String, String> overrides) {
        Properties defaults = propsFromResource(DEFAULTS_RESOURCE);
        Properties props = configFile == null ? defaults : propsFromFile(configFile, defaults);
        return new RoofAreaConfig(props, System.getenv(), System.getProperties(), overrides);
    }

    /** Load with explicitly supplied environment and system properties instead of the real process ones. */
    public static RoofAreaConfig load (Path configFile, Map<String, String> overrides,
                                       Map<?, ?> environment, Map<?, ?> systemProperties) {
        Properties defaults = propsFromResource(DEFAULTS_RESOURCE);
        Properties props = configFile == null ? defaults : propsFromFile(configFile, defaults);
        return new RoofAreaConfig(props, environment, systemProperties, overrides);
    }

    /** Probability threshold in [0, 1]. */
    public double threshold () { return threshold; }
    /** Tile size in pixels. */
    public int    tileSize ()  { return tileSize; }
    /** Tile overlap in pixels. */
    public int    overlap ()   { return overlap; }
    /** Minimum roof area in square meters. */
    public double minAreaM2 () { return minAreaM2; }
    public long   seed ()      { return seed; }
    public String logLevel ()  { return logLevel; }

    @Override
    public String toString () {
        return String.format(
            "threshold=%s, tile-size=%d, overlap=%d, min-area-m2=%s, seed=%d, log-level=%s",
            threshold, tileSize, overlap, minAreaM2, seed, logLevel
        );
    }

}
