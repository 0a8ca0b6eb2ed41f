package com.conveyal.roofarea.pipeline;

import com.conveyal.roofarea.RoofAreaException;
import com.conveyal.roofarea.common.Crs;
import com.conveyal.roofarea.common.Reprojector;
import org.locationtech.jts.geom.Envelope;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A bounding box, in any CRS, limiting the part of a raster that is processed.
 */
public final class AreaOfInterest {

    public final Envelope bounds;

    public final Crs crs;

    public AreaOfInterest (Envelope bounds, Crs crs) {
        this.bounds = checkNotNull(bounds);
        this.crs = checkNotNull(crs);
    }

    /**
     * Parse bounds given as "minx,miny,maxx,maxy", with x being easting or longitude.
     * @throws RoofAreaException of type CONFIGURATION if the text does not describe a non-empty box.
     */
    public static AreaOfInterest parse (String bounds, String crs) {
        String[] parts = bounds.split(",");
        if (parts.length != 4) {
            throw RoofAreaException.configuration("Area of interest must be minx,miny,maxx,maxy, got: " + bounds);
        }
        double[] values = new double[4];
        try {
            for (int i = 0; i < 4; i++) {
                values[i] = Double.parseDouble(parts[i].trim());
            }
        } catch (NumberFormatException e) {
            throw new RoofAreaException(RoofAreaException.Type.CONFIGURATION,
                    "Area of interest contains a value that is not a number: " + bounds, e);
        }
        if (values[0] >= values[2] || values[1] >= values[3]) {
            throw RoofAreaException.configuration("Area of interest minimums must be less than maximums: " + bounds);
        }
        return new AreaOfInterest(new Envelope(values[0], values[2], values[1], values[3]), Crs.of(crs));
    }

    /** These bounds expressed in the given raster CRS. */
    public Envelope boundsIn (Crs rasterCrs) {
        return reprojectToRasterCrs(bounds, crs, rasterCrs);
    }

    /**
     * Reproject bounds into a raster's CRS. When both CRSs are the same the bounds are returned unchanged, so no
     * precision is lost to a pointless round trip through a transform.
     */
    public static Envelope reprojectToRasterCrs (Envelope bounds, Crs aoiCrs, Crs rasterCrs) {
        if (rasterCrs == null) {
            throw RoofAreaException.configuration("Cannot apply an area of interest to a raster without a CRS.");
        }
        if (aoiCrs.equals(rasterCrs)) {
            return bounds;
        }
        return Reprojector.reprojectBounds(bounds, aoiCrs, rasterCrs);
    }

    public static Envelope reprojectToRasterCrs (Envelope bounds, String aoiCrs, String rasterCrs) {
        return reprojectToRasterCrs(bounds, Crs.of(aoiCrs), Crs.of(rasterCrs));
    }

    @Override
    public String toString () {
        return bounds + " in " + crs;
    }

}
