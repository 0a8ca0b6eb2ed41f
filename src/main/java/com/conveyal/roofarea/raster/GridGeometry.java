package com.conveyal.roofarea.raster;

import com.conveyal.roofarea.common.Crs;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.locationtech.jts.geom.util.NoninvertibleTransformationException;

import java.util.Arrays;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The shape and georeferencing of a raster: pixel grid dimensions, the affine transform from pixel (column, row)
 * coordinates to world coordinates, and the CRS of those world coordinates. Pixel coordinates refer to pixel corners,
 * so the center of the pixel at column c and row r is at (c + 0.5, r + 0.5).
 *
 * The transform must be invertible and must have nonzero scale on both axes, so that each pixel covers a known,
 * nonzero area on the ground.
 */
public class GridGeometry {

    /** Tolerance in pixels within which fractional window edges are snapped to the nearest whole pixel. */
    private static final double PIXEL_SNAP_TOLERANCE = 1e-6;

    public final int width;

    public final int height;

    /** May be null for rasters without a CRS. Operations that need to reproject onto this grid will then fail. */
    public final Crs crs;

    // AffineTransformation is mutable, so keep private copies and hand out copies.
    private final AffineTransformation pixelToWorld;
    private final AffineTransformation worldToPixel;

    public GridGeometry (int width, int height, AffineTransformation pixelToWorld, Crs crs) {
        checkArgument(width > 0 && height > 0, "Grid dimensions must be positive, got %sx%s.", width, height);
        this.width = width;
        this.height = height;
        this.crs = crs;
        this.pixelToWorld = new AffineTransformation(pixelToWorld);
        double[] m = pixelToWorld.getMatrixEntries();
        checkArgument(m[0] != 0 && m[4] != 0, "Raster transform must have nonzero pixel size on both axes.");
        try {
            this.worldToPixel = pixelToWorld.getInverse();
        } catch (NoninvertibleTransformationException e) {
            throw new IllegalArgumentException("Raster transform must be invertible.", e);
        }
    }

    /**
     * The usual north-up transform for a grid whose top left corner is at (west, north), with pixels xSize wide and
     * ySize tall in world units. Rows increase southward.
     */
    public static AffineTransformation originTransform (double west, double north, double xSize, double ySize) {
        return new AffineTransformation(xSize, 0, west, 0, -ySize, north);
    }

    public AffineTransformation pixelToWorld () {
        return new AffineTransformation(pixelToWorld);
    }

    public AffineTransformation worldToPixel () {
        return new AffineTransformation(worldToPixel);
    }

    /** Absolute pixel width in CRS units (the x scale of the transform). */
    public double pixelSizeX () {
        return Math.abs(pixelToWorld.getMatrixEntries()[0]);
    }

    /** Absolute pixel height in CRS units (the y scale of the transform). */
    public double pixelSizeY () {
        return Math.abs(pixelToWorld.getMatrixEntries()[4]);
    }

    /** Area covered by one pixel, in squared CRS units. Square meters when the CRS is metric. */
    public double pixelArea () {
        double[] m = pixelToWorld.getMatrixEntries();
        return Math.abs(m[0] * m[4]);
    }

    public int pixelCount () {
        return width * height;
    }

    public Coordinate toWorld (double col, double row) {
        return pixelToWorld.transform(new Coordinate(col, row), new Coordinate());
    }

    public Coordinate toPixel (double x, double y) {
        return worldToPixel.transform(new Coordinate(x, y), new Coordinate());
    }

    /** The envelope of the whole grid in world coordinates. */
    public Envelope bounds () {
        Envelope envelope = new Envelope();
        envelope.expandToInclude(toWorld(0, 0));
        envelope.expandToInclude(toWorld(width, 0));
        envelope.expandToInclude(toWorld(0, height));
        envelope.expandToInclude(toWorld(width, height));
        return envelope;
    }

    /**
     * Find the window of whole pixels covering the given bounds, which must be in this grid's CRS. Window edges that
     * fall within a tiny tolerance of a pixel edge are snapped to it, others are expanded outward to whole pixels.
     * The window is clipped to the grid.
     *
     * @throws IllegalArgumentException if the bounds do not overlap the grid.
     */
    public Window windowForBounds (Envelope bounds) {
        Envelope pixelEnvelope = new Envelope();
        pixelEnvelope.expandToInclude(toPixel(bounds.getMinX(), bounds.getMinY()));
        pixelEnvelope.expandToInclude(toPixel(bounds.getMaxX(), bounds.getMinY()));
        pixelEnvelope.expandToInclude(toPixel(bounds.getMinX(), bounds.getMaxY()));
        pixelEnvelope.expandToInclude(toPixel(bounds.getMaxX(), bounds.getMaxY()));
        int colMin = Math.max(0, snapDown(pixelEnvelope.getMinX()));
        int rowMin = Math.max(0, snapDown(pixelEnvelope.getMinY()));
        int colMax = Math.min(width, snapUp(pixelEnvelope.getMaxX()));
        int rowMax = Math.min(height, snapUp(pixelEnvelope.getMaxY()));
        checkArgument(colMax > colMin && rowMax > rowMin, "Bounds %s do not overlap the raster.", bounds);
        return new Window(colMin, rowMin, colMax - colMin, rowMax - rowMin);
    }

    private static int snapDown (double pixel) {
        double rounded = Math.rint(pixel);
        return Math.abs(pixel - rounded) < PIXEL_SNAP_TOLERANCE ? (int) rounded : (int) Math.floor(pixel);
    }

    private static int snapUp (double pixel) {
        double rounded = Math.rint(pixel);
        return Math.abs(pixel - rounded) < PIXEL_SNAP_TOLERANCE ? (int) rounded : (int) Math.ceil(pixel);
    }

    /** The geometry of the given window of this grid, with the transform shifted to the window's top left pixel. */
    public GridGeometry subGrid (Window window) {
        checkArgument(window.fitsWithin(width, height), "%s does not fit within %sx%s grid.", window, width, height);
        AffineTransformation shifted = AffineTransformation.translationInstance(window.colOff, window.rowOff)
                .compose(pixelToWorld);
        return new GridGeometry(window.width, window.height, shifted, crs);
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (other == null || getClass() != other.getClass()) return false;
        GridGeometry that = (GridGeometry) other;
        return width == that.width && height == that.height && Objects.equals(crs, that.crs)
                && Arrays.equals(pixelToWorld.getMatrixEntries(), that.pixelToWorld.getMatrixEntries());
    }

    @Override
    public int hashCode () {
        return Objects.hash(width, height, crs, Arrays.hashCode(pixelToWorld.getMatrixEntries()));
    }

    @Override
    public String toString () {
        return String.format("GridGeometry[%dx%d, transform=%s, crs=%s]", width, height, pixelToWorld, crs);
    }

}
