package com.conveyal.roofarea.mask;

import com.conveyal.roofarea.common.GeometryUtils;
import com.conveyal.roofarea.raster.BooleanMask;
import com.conveyal.roofarea.raster.GridGeometry;
import gnu.trove.list.array.TDoubleArrayList;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.ArrayList;
import java.util.List;

/**
 * Burns polygon interiors into boolean masks aligned with a raster grid. A pixel is inside a polygon when its center
 * is inside: pixels that an edge merely touches are not burned. Holes are honored by the even-odd rule, which treats
 * every ring the same way, so a pixel centered in a hole is outside.
 *
 * Geometries must already be in the CRS of the grid. Rasterization happens in pixel space: ring vertices are mapped
 * through the inverse of the grid transform, then each pixel row is scanned at its center line.
 */
public abstract class PolygonRasterizer {

    /** @return a new mask that is true wherever any of the given polygonal geometries covers a pixel center. */
    public static BooleanMask rasterize (Iterable<? extends Geometry> geometries, GridGeometry grid) {
        BooleanMask mask = BooleanMask.empty(grid);
        AffineTransformation worldToPixel = grid.worldToPixel();
        for (Polygon polygon : GeometryUtils.polygons(geometries)) {
            burn(polygon, worldToPixel, mask);
        }
        return mask;
    }

    public static BooleanMask rasterize (Geometry geometry, GridGeometry grid) {
        return rasterize(List.of(geometry), grid);
    }

    /** Set the pixels covered by one polygon to true in the target mask. Pixels already set stay set. */
    static void burn (Polygon polygon, AffineTransformation worldToPixel, BooleanMask target) {
        List<double[]> rings = new ArrayList<>();
        Envelope pixelEnvelope = new Envelope();
        rings.add(pixelRing(polygon.getExteriorRing(), worldToPixel, pixelEnvelope));
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            rings.add(pixelRing(polygon.getInteriorRingN(i), worldToPixel, null));
        }
        // Rows whose center line y = row + 0.5 falls within the polygon's vertical extent.
        int firstRow = Math.max(0, (int) Math.ceil(pixelEnvelope.getMinY() - 0.5));
        int lastRow = Math.min(target.height - 1, (int) Math.floor(pixelEnvelope.getMaxY() - 0.5));
        TDoubleArrayList crossings = new TDoubleArrayList();
        for (int row = firstRow; row <= lastRow; row++) {
            double yCenter = row + 0.5;
            crossings.resetQuick();
            for (double[] ring : rings) {
                addCrossings(ring, yCenter, crossings);
            }
            crossings.sort();
            for (int i = 0; i + 1 < crossings.size(); i += 2) {
                // Pixel col is inside when xa <= col + 0.5 < xb.
                int fromCol = Math.max(0, (int) Math.ceil(crossings.get(i) - 0.5));
                int toCol = Math.min(target.width, (int) Math.ceil(crossings.get(i + 1) - 0.5));
                target.setRange(row, fromCol, toCol);
            }
        }
    }

    /**
     * Ring vertices in pixel coordinates, as a flat array x0 y0 x1 y1 ... with the closing vertex repeated.
     * Expands the envelope to include them if one is supplied.
     */
    private static double[] pixelRing (LinearRing ring, AffineTransformation worldToPixel, Envelope envelope) {
        CoordinateSequence sequence = ring.getCoordinateSequence();
        double[] xy = new double[sequence.size() * 2];
        Coordinate world = new Coordinate();
        Coordinate pixel = new Coordinate();
        for (int i = 0; i < sequence.size(); i++) {
            world.x = sequence.getX(i);
            world.y = sequence.getY(i);
            worldToPixel.transform(world, pixel);
            xy[2 * i] = pixel.x;
            xy[2 * i + 1] = pixel.y;
            if (envelope != null) envelope.expandToInclude(pixel.x, pixel.y);
        }
        return xy;
    }

    /**
     * Add the x coordinates where the ring's edges cross the horizontal line at y. An edge counts when its endpoints
     * lie strictly on opposite sides, with an endpoint exactly on the line counted as below it. This half-open rule
     * means a vertex on the line is crossed once or not at all, never twice.
     */
    private static void addCrossings (double[] ring, double y, TDoubleArrayList crossings) {
        for (int i = 0; i + 3 < ring.length; i += 2) {
            double x0 = ring[i], y0 = ring[i + 1], x1 = ring[i + 2], y1 = ring[i + 3];
            if ((y0 > y) != (y1 > y)) {
                crossings.add(x0 + (y - y0) * (x1 - x0) / (y1 - y0));
            }
        }
    }

}
