package com.conveyal.roofarea.raster;

import com.conveyal.roofarea.common.Crs;
import org.locationtech.jts.geom.Envelope;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * A georeferenced raster held in memory: a GridGeometry plus one or more bands of samples. Samples are stored as
 * doubles whatever their type on disk, one flattened row-major array per band, so the sample at (col, row) of band b
 * is bands[b][row * width + col].
 */
public class RasterGrid {

    public final GridGeometry geometry;

    public final int width;

    public final int height;

    private final double[][] bands;

    /** The band arrays are used directly, not copied. */
    public RasterGrid (GridGeometry geometry, double[]... bands) {
        checkArgument(bands.length > 0, "A raster must have at least one band.");
        for (double[] band : bands) {
            checkArgument(band.length == geometry.pixelCount(),
                    "Band has %s samples, expected %s.", band.length, geometry.pixelCount());
        }
        this.geometry = geometry;
        this.width = geometry.width;
        this.height = geometry.height;
        this.bands = bands;
    }

    /** Build a single band raster from a row-major 2D array, rows[row][col]. Mostly useful in tests. */
    public static RasterGrid fromRows (GridGeometry geometry, double[][] rows) {
        checkArgument(rows.length == geometry.height, "Expected %s rows, got %s.", geometry.height, rows.length);
        double[] band = new double[geometry.pixelCount()];
        for (int row = 0; row < rows.length; row++) {
            checkArgument(rows[row].length == geometry.width, "Row %s has the wrong length.", row);
            System.arraycopy(rows[row], 0, band, row * geometry.width, geometry.width);
        }
        return new RasterGrid(geometry, band);
    }

    public Crs crs () {
        return geometry.crs;
    }

    public int bandCount () {
        return bands.length;
    }

    /** The backing array of the given band. Writes through to this raster. */
    public double[] band (int band) {
        checkElementIndex(band, bands.length, "band");
        return bands[band];
    }

    public double get (int band, int col, int row) {
        return bands[band][row * width + col];
    }

    /**
     * Copy the pixels in the given window into a new raster, georeferenced so that each pixel keeps its position on
     * the ground.
     */
    public RasterGrid read (Window window) {
        GridGeometry subGeometry = geometry.subGrid(window);
        double[][] subBands = new double[bands.length][];
        for (int b = 0; b < bands.length; b++) {
            double[] sub = new double[window.pixelCount()];
            for (int row = 0; row < window.height; row++) {
                System.arraycopy(bands[b], (window.rowOff + row) * width + window.colOff,
                        sub, row * window.width, window.width);
            }
            subBands[b] = sub;
        }
        return new RasterGrid(subGeometry, subBands);
    }

    /** Read the window covering the given bounds, which must be expressed in this raster's CRS. */
    public RasterGrid read (Envelope bounds) {
        return read(geometry.windowForBounds(bounds));
    }

}
