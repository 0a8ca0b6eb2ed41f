package com.conveyal.roofarea.common;

import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.ProjCoordinate;

/**
 * Moves envelopes and geometries between coordinate reference systems. Coordinates are always easting / longitude
 * first. When the source and destination CRS are equal the input is returned as-is, without any transform.
 */
public abstract class Reprojector {

    /**
     * Reproject an axis-aligned bounding box. Coordinate transforms are generally non-linear and do not preserve axis
     * alignment, so all four corners are transformed (not just the two diagonal ones) and the result is their envelope.
     * A round trip through another CRS can therefore only grow the box.
     */
    public static Envelope reprojectBounds (Envelope bounds, Crs sourceCrs, Crs destinationCrs) {
        if (sourceCrs.equals(destinationCrs)) {
            return bounds;
        }
        CoordinateTransform transform = sourceCrs.transformTo(destinationCrs);
        double[] xs = { bounds.getMinX(), bounds.getMaxX(), bounds.getMinX(), bounds.getMaxX() };
        double[] ys = { bounds.getMinY(), bounds.getMinY(), bounds.getMaxY(), bounds.getMaxY() };
        Envelope result = new Envelope();
        ProjCoordinate projected = new ProjCoordinate();
        for (int i = 0; i < 4; i++) {
            transform.transform(new ProjCoordinate(xs[i], ys[i]), projected);
            result.expandToInclude(projected.x, projected.y);
        }
        return result;
    }

    public static Envelope reprojectBounds (Envelope bounds, String sourceCrs, String destinationCrs) {
        return reprojectBounds(bounds, Crs.of(sourceCrs), Crs.of(destinationCrs));
    }

    /** @return a reprojected copy of the geometry. The supplied geometry is not modified. */
    public static Geometry reprojectGeometry (Geometry geometry, Crs sourceCrs, Crs destinationCrs) {
        if (geometry == null || sourceCrs.equals(destinationCrs)) {
            return geometry;
        }
        Geometry copy = geometry.copy();
        copy.apply(new TransformFilter(sourceCrs.transformTo(destinationCrs)));
        return copy;
    }

    /** Applies a proj4j transform to every coordinate of a JTS geometry in place. */
    private static class TransformFilter implements CoordinateSequenceFilter {

        private final CoordinateTransform transform;
        private final ProjCoordinate source = new ProjCoordinate();
        private final ProjCoordinate target = new ProjCoordinate();

        TransformFilter (CoordinateTransform transform) {
            this.transform = transform;
        }

        @Override
        public void filter (CoordinateSequence seq, int i) {
            source.x = seq.getX(i);
            source.y = seq.getY(i);
            transform.transform(source, target);
            seq.setOrdinate(i, CoordinateSequence.X, target.x);
            seq.setOrdinate(i, CoordinateSequence.Y, target.y);
        }

        @Override
        public boolean isDone () {
            return false;
        }

        @Override
        public boolean isGeometryChanged () {
            return true;
        }
    }

}
