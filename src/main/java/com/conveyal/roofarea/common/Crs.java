package com.conveyal.roofarea.common;

import com.conveyal.roofarea.RoofAreaException;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.proj.LongLatProjection;
import org.locationtech.proj4j.proj.Projection;
import org.locationtech.proj4j.units.Units;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A coordinate reference system, normalized as soon as it enters the system. Entry points accept either a structured
 * proj4j CoordinateReferenceSystem or a textual identifier and convert it with one of the static factory methods.
 *
 * Two instances are equal when their PROJ.4 definitions are the same, so "EPSG:4326" and "OGC:CRS84" (which differ
 * only in axis order, which proj4j ignores, always using easting / longitude first) compare equal.
 */
public final class Crs {

    public static final String WGS84 = "EPSG:4326";

    /** Default projected metric CRS used when areas must be computed for data in geographic coordinates. */
    public static final String WEB_MERCATOR = "EPSG:3857";

    /** Code meaning "user defined" in GeoTIFF keys and some other EPSG-coded contexts. */
    public static final int USER_DEFINED_CODE = 32767;

    private static final CRSFactory CRS_FACTORY = new CRSFactory();

    /** e.g. urn:ogc:def:crs:EPSG::3857, urn:ogc:def:crs:EPSG:6.6:3857 or http://www.opengis.net/def/crs/EPSG/0/3857 */
    private static final Pattern EPSG_URN = Pattern.compile(
            "(?:urn:ogc:def:crs:epsg:[^:]*:|https?://www\\.opengis\\.net/def/crs/epsg/[^/]*/)(\\d+)");

    private static final Pattern EPSG_CODE = Pattern.compile("epsg:(\\d+)");

    /** Normalized textual identifier, an authority:code string or a PROJ.4 parameter string. */
    public final String identifier;

    private final CoordinateReferenceSystem crs;

    /** Normalized PROJ.4 definition used for equality. */
    private final String definition;

    private Crs (String identifier, CoordinateReferenceSystem crs) {
        this.identifier = identifier;
        this.crs = crs;
        this.definition = Arrays.stream(crs.getParameters())
                .map(String::trim)
                .filter(p -> !p.isEmpty())
                .collect(Collectors.joining(" "));
    }

    /**
     * Parse a textual CRS identifier: an authority:code string in any case (EPSG:3857, epsg:3857), an OGC URN or URL,
     * CRS84, or a PROJ.4 parameter string starting with "+".
     */
    public static Crs of (String input) {
        checkNotNull(input, "CRS identifier must not be null.");
        String trimmed = input.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        try {
            if (trimmed.startsWith("+")) {
                return new Crs(trimmed, CRS_FACTORY.createFromParameters(null, trimmed));
            }
            if (lower.endsWith("crs84") || lower.endsWith("crs:84")) {
                return fromEpsg(4326);
            }
            Matcher urn = EPSG_URN.matcher(lower);
            if (urn.matches()) {
                return fromEpsg(Integer.parseInt(urn.group(1)));
            }
            Matcher code = EPSG_CODE.matcher(lower);
            if (code.matches()) {
                return fromEpsg(Integer.parseInt(code.group(1)));
            }
            String name = trimmed.toUpperCase(Locale.ROOT);
            return new Crs(name, CRS_FACTORY.createFromName(name));
        } catch (RoofAreaException e) {
            throw e;
        } catch (RuntimeException e) {
            // proj4j reports unparseable names with a variety of unchecked exceptions, not only Proj4jException.
            throw new RoofAreaException(RoofAreaException.Type.CONFIGURATION, "Unrecognized CRS: " + input, e);
        }
    }

    /** Wrap an already constructed proj4j CRS. */
    public static Crs of (CoordinateReferenceSystem crs) {
        checkNotNull(crs, "CRS must not be null.");
        String name = crs.getName();
        if (name != null && EPSG_CODE.matcher(name.toLowerCase(Locale.ROOT)).matches()) {
            return new Crs(name.toUpperCase(Locale.ROOT), crs);
        }
        return new Crs(String.join(" ", crs.getParameters()), crs);
    }

    public static Crs fromEpsg (int code) {
        String name = "EPSG:" + code;
        try {
            return new Crs(name, CRS_FACTORY.createFromName(name));
        } catch (RuntimeException e) {
            throw new RoofAreaException(RoofAreaException.Type.CONFIGURATION, "Unrecognized CRS: " + name, e);
        }
    }

    /** @return the EPSG code if this CRS was identified by one, or -1. */
    public int epsgCode () {
        Matcher code = EPSG_CODE.matcher(identifier.toLowerCase(Locale.ROOT));
        return code.matches() ? Integer.parseInt(code.group(1)) : -1;
    }

    public boolean isGeographic () {
        return crs.getProjection() instanceof LongLatProjection;
    }

    public boolean isProjected () {
        return !isGeographic();
    }

    /** True if this is a projected CRS whose axis units are meters. */
    public boolean isMetric () {
        if (isGeographic()) return false;
        Projection projection = crs.getProjection();
        return projection != null && Units.METRES.equals(projection.getUnits());
    }

    /** A new transform between this CRS and the given one. Transforms are not threadsafe, so they are not shared. */
    public CoordinateTransform transformTo (Crs destination) {
        return new CoordinateTransformFactory().createTransform(this.crs, destination.crs);
    }

    public CoordinateReferenceSystem toProj4j () {
        return crs;
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (other == null || getClass() != other.getClass()) return false;
        return definition.equals(((Crs) other).definition);
    }

    @Override
    public int hashCode () {
        return Objects.hash(definition);
    }

    @Override
    public String toString () {
        return identifier;
    }

}
