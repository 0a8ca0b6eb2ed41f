package com.conveyal.roofarea.common;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.ProjCoordinate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ReprojectorTest {

    private static final Crs WGS84 = Crs.of("EPSG:4326");
    private static final Crs WEB_MERCATOR = Crs.of("EPSG:3857");

    @Test
    public void sameCrsReturnsInputUnchanged () {
        Envelope bounds = new Envelope(0, 1, 0, 1);
        assertSame(bounds, Reprojector.reprojectBounds(bounds, WGS84, Crs.of("epsg:4326")));
        assertSame(bounds, Reprojector.reprojectBounds(bounds, "EPSG:4326", "OGC:CRS84"));
    }

    /** The result must be the envelope of all four transformed corners, x (longitude) first. */
    @Test
    public void boundsMatchFourCornerTransform () {
        Envelope bounds = new Envelope(-5, -4, 50, 51);
        CoordinateTransform transform = WGS84.transformTo(WEB_MERCATOR);
        Envelope expected = new Envelope();
        double[][] corners = { {-5, 50}, {-4, 50}, {-5, 51}, {-4, 51} };
        for (double[] corner : corners) {
            ProjCoordinate projected = transform.transform(new ProjCoordinate(corner[0], corner[1]), new ProjCoordinate());
            expected.expandToInclude(projected.x, projected.y);
        }
        Envelope actual = Reprojector.reprojectBounds(bounds, WGS84, WEB_MERCATOR);
        assertEquals(expected, actual);
        // Known web mercator values for these longitudes and latitudes, to within a meter.
        assertEquals(-556597.45, actual.getMinX(), 1);
        assertEquals(-445277.96, actual.getMaxX(), 1);
        assertEquals(6446275.84, actual.getMinY(), 1);
        assertEquals(6621293.72, actual.getMaxY(), 1);
    }

    @Test
    public void roundTripEnclosesOriginal () {
        Envelope original = new Envelope(-5, -4, 50, 51);
        Envelope projected = Reprojector.reprojectBounds(original, WGS84, WEB_MERCATOR);
        Envelope roundTrip = Reprojector.reprojectBounds(projected, WEB_MERCATOR, WGS84);
        Envelope tolerant = new Envelope(roundTrip);
        tolerant.expandBy(1e-9);
        assertTrue(tolerant.contains(original));
        assertEquals(original.getArea(), roundTrip.getArea(), 1e-9);
    }

    /** Through a transverse mercator projection the box can grow, but only slightly at this scale. */
    @Test
    public void roundTripThroughUtmStaysClose () {
        Envelope original = new Envelope(500000, 510000, 5200000, 5210000);
        Crs utm = Crs.of("EPSG:32633");
        Envelope geographic = Reprojector.reprojectBounds(original, utm, WGS84);
        Envelope roundTrip = Reprojector.reprojectBounds(geographic, WGS84, utm);
        assertEquals(original.getMinX(), roundTrip.getMinX(), 100);
        assertEquals(original.getMaxX(), roundTrip.getMaxX(), 100);
        assertEquals(original.getMinY(), roundTrip.getMinY(), 100);
        assertEquals(original.getMaxY(), roundTrip.getMaxY(), 100);
    }

    @Test
    public void geometryReprojectionCopies () {
        Polygon box = GeometryUtils.box(-5, 50, -4, 51);
        Geometry projected = Reprojector.reprojectGeometry(box, WGS84, WEB_MERCATOR);
        assertNotSame(box, projected);
        assertEquals(-5, box.getEnvelopeInternal().getMinX(), 0);
        assertEquals(-556597.45, projected.getEnvelopeInternal().getMinX(), 1);
        assertSame(box, Reprojector.reprojectGeometry(box, WGS84, WGS84));
    }

}
