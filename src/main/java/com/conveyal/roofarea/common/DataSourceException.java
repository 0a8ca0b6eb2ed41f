package com.conveyal.roofarea.common;

/**
 * Thrown when a raster or vector file can be read but its contents are not usable: an unsupported format, missing
 * georeferencing, malformed GeoJSON and so on. Plain I/O failures are reported as IOException instead.
 */
public class DataSourceException extends RuntimeException {

    public DataSourceException (String message) {
        super(message);
    }

    public DataSourceException (String message, Throwable cause) {
        super(message, cause);
    }

}
