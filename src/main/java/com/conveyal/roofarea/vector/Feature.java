package com.conveyal.roofarea.vector;

import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One record of a vector data source: a geometry (which may be null) and its attributes. Attribute values are plain
 * Java objects as produced by Jackson: String, Integer, Long, Double, Boolean, nested Maps and Lists, or null.
 */
public class Feature {

    /** The feature's own identifier if the source provided one, otherwise null. */
    public final Object id;

    public final Geometry geometry;

    public final Map<String, Object> properties;

    public Feature (Object id, Geometry geometry, Map<String, ?> properties) {
        this.id = id;
        this.geometry = geometry;
        this.properties = properties == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public Feature (Geometry geometry, Map<String, ?> properties) {
        this(null, geometry, properties);
    }

    public Feature (Geometry geometry) {
        this(null, geometry, null);
    }

    /** @return the attribute value, or null if the attribute is absent or explicitly null. */
    public Object get (String attribute) {
        return properties.get(attribute);
    }

    public boolean hasGeometry () {
        return geometry != null && !geometry.isEmpty();
    }

    /** A copy of this feature with the same id and attributes but a different geometry. */
    public Feature withGeometry (Geometry newGeometry) {
        return new Feature(id, newGeometry, properties);
    }

    @Override
    public String toString () {
        return "Feature{id=" + id + ", geometry=" + (geometry == null ? null : geometry.getGeometryType())
                + ", properties=" + properties + "}";
    }

}
