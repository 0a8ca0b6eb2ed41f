package com.conveyal.roofarea.mask;

import com.conveyal.roofarea.RoofAreaException;
import com.conveyal.roofarea.raster.BooleanMask;
import com.conveyal.roofarea.raster.GridGeometry;
import com.conveyal.roofarea.vector.FeatureCollection;

/**
 * Turns vector ground truth into a mask that lines up pixel for pixel with a predicted mask, so the two can be
 * compared with the metrics engine.
 */
public abstract class GroundTruthRasterizer {

    public static final String MISSING_CRS_MESSAGE = "Ground truth vector is missing a CRS definition.";

    /**
     * @param reference grid of the predicted mask: shape, transform and CRS of the output.
     * @param groundTruth polygons in any CRS. An empty collection yields an all-false mask, even without a CRS.
     */
    public static BooleanMask rasterize (GridGeometry reference, FeatureCollection groundTruth) {
        if (groundTruth == null || groundTruth.isEmpty()) {
            return BooleanMask.empty(reference);
        }
        if (groundTruth.crs == null) {
            throw RoofAreaException.configuration(MISSING_CRS_MESSAGE);
        }
        if (reference.crs == null) {
            throw RoofAreaException.configuration("Cannot place ground truth on a raster without a CRS.");
        }
        return PolygonRasterizer.rasterize(groundTruth.reprojectTo(reference.crs).geometries(), reference);
    }

}
