package com.conveyal.roofarea.metrics;

import com.conveyal.roofarea.RoofAreaException;
import com.conveyal.roofarea.common.Crs;
import com.conveyal.roofarea.raster.BooleanMask;
import com.conveyal.roofarea.raster.GridGeometry;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Conversions between pixel counts and real world areas, and the choice of a CRS in which areas are meaningful.
 */
public abstract class AreaUtils {

    /** Area of the true pixels of a mask, given the pixel width and height in meters. */
    public static double maskAreaM2 (BooleanMask mask, double pixelSizeX, double pixelSizeY) {
        checkArgument(Double.isFinite(pixelSizeX) && Double.isFinite(pixelSizeY), "Pixel sizes must be finite.");
        return (double) mask.count() * pixelSizeX * pixelSizeY;
    }

    /** Area of the true pixels of a mask lying on the given grid, which should have a metric CRS. */
    public static double maskAreaM2 (BooleanMask mask, GridGeometry grid) {
        checkArgument(mask.sameShape(grid), "Mask and grid shapes differ.");
        return maskAreaM2(mask, grid.pixelSizeX(), grid.pixelSizeY());
    }

    /** Absolute pixel width and height of a grid in CRS units, which are meters for a metric CRS. */
    public static double[] pixelSizeM (GridGeometry grid) {
        return new double[] { grid.pixelSizeX(), grid.pixelSizeY() };
    }

    public static Crs ensureMetricCrs (Crs crs) {
        return ensureMetricCrs(crs, Crs.of(Crs.WEB_MERCATOR));
    }

    /**
     * @return the given CRS if it is projected with meter units, otherwise the target CRS, into which data should be
     * reprojected before measuring areas.
     * @throws RoofAreaException of type CONFIGURATION if no CRS is given.
     */
    public static Crs ensureMetricCrs (Crs crs, Crs target) {
        if (crs == null) {
            throw RoofAreaException.configuration("CRS is required to compute metric areas.");
        }
        return crs.isMetric() ? crs : target;
    }

    public static Crs ensureMetricCrs (String crs, String target) {
        if (crs == null) {
            throw RoofAreaException.configuration("CRS is required to compute metric areas.");
        }
        return ensureMetricCrs(Crs.of(crs), Crs.of(target));
    }

}
