package com.conveyal.roofarea.mask;

import com.conveyal.roofarea.RoofAreaException;
import com.conveyal.roofarea.raster.BooleanMask;
import com.conveyal.roofarea.raster.GridGeometry;
import com.conveyal.roofarea.vector.FeatureCollection;
import org.slf4j.Logger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Restricts a candidate roof mask to known building footprints: a pixel stays in the mask only if it is also inside
 * at least one footprint. Footprints that overlap each other simply combine, a pixel covered by two footprints is
 * treated like a pixel covered by one.
 */
public abstract class FootprintConstrainer {

    public static final String NO_FOOTPRINTS_MESSAGE = "No building footprints provided. "
            + "Provide --footprints to run the baseline or train a model and pass --model.";

    public static final String EMPTY_FOOTPRINTS_MESSAGE = "No building footprints found in the provided file. "
            + "Provide footprints or train a model and pass --model.";

    public static final String MISSING_CRS_MESSAGE = "Building footprints are missing a CRS definition.";

    /**
     * @param mask candidate mask aligned with the grid. Not modified.
     * @param grid the raster grid the mask belongs to, whose CRS the footprints are reprojected into.
     * @param footprints building footprints in any CRS. Must be non-null, non-empty and have a CRS.
     * @param log receives a summary of the footprints applied.
     * @return a new mask, the intersection of the candidate mask and the union of all footprints.
     */
    public static BooleanMask constrain (BooleanMask mask, GridGeometry grid, FeatureCollection footprints, Logger log) {
        checkNotNull(mask, "Mask must not be null.");
        checkArgument(mask.sameShape(grid), "Mask is %sx%s but grid is %sx%s.",
                mask.width, mask.height, grid.width, grid.height);
        if (footprints == null) {
            throw RoofAreaException.precondition(NO_FOOTPRINTS_MESSAGE);
        }
        if (footprints.isEmpty()) {
            throw RoofAreaException.precondition(EMPTY_FOOTPRINTS_MESSAGE);
        }
        if (footprints.crs == null) {
            throw RoofAreaException.configuration(MISSING_CRS_MESSAGE);
        }
        if (grid.crs == null) {
            throw RoofAreaException.configuration("Cannot place building footprints on a raster without a CRS.");
        }
        FeatureCollection reprojected = footprints.reprojectTo(grid.crs);
        BooleanMask footprintUnion = PolygonRasterizer.rasterize(reprojected.geometries(), grid);
        BooleanMask constrained = mask.and(footprintUnion);
        log.info("Applied baseline mask to {} building footprints", footprints.size());
        return constrained;
    }

}
