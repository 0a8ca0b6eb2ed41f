package com.conveyal.roofarea.common;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.List;

/**
 * Reusable static methods for working with JTS geometries: a shared factory, flattening of polygonal geometries and
 * construction of boxes.
 */
public abstract class GeometryUtils {

    public static final GeometryFactory geometryFactory = new GeometryFactory();

    /**
     * Decompose geometries into their constituent simple polygons. Multi-polygons and geometry collections are
     * flattened recursively, nulls and empty geometries are skipped, and non-polygonal parts (points, lines) are
     * ignored since they have no interior to rasterize.
     */
    public static List<Polygon> polygons (Iterable<? extends Geometry> geometries) {
        List<Polygon> polygons = new ArrayList<>();
        for (Geometry geometry : geometries) {
            addPolygons(geometry, polygons);
        }
        return polygons;
    }

    public static List<Polygon> polygons (Geometry geometry) {
        List<Polygon> polygons = new ArrayList<>();
        addPolygons(geometry, polygons);
        return polygons;
    }

    private static void addPolygons (Geometry geometry, List<Polygon> polygons) {
        if (geometry == null || geometry.isEmpty()) return;
        if (geometry instanceof Polygon) {
            polygons.add((Polygon) geometry);
        } else {
            // MultiPolygon is a GeometryCollection, as is a heterogeneous collection. A Polygon has one "part", itself.
            int n = geometry.getNumGeometries();
            if (n == 1 && geometry.getGeometryN(0) == geometry) return;
            for (int i = 0; i < n; i++) {
                addPolygons(geometry.getGeometryN(i), polygons);
            }
        }
    }

    /** An axis-aligned rectangle polygon, like shapely's box(minx, miny, maxx, maxy). */
    public static Polygon box (double minX, double minY, double maxX, double maxY) {
        return geometryFactory.createPolygon(new Coordinate[] {
                new Coordinate(minX, minY),
                new Coordinate(maxX, minY),
                new Coordinate(maxX, maxY),
                new Coordinate(minX, maxY),
                new Coordinate(minX, minY)
        });
    }

}
