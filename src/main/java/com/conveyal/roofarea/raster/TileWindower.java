package com.conveyal.roofarea.raster;

import com.conveyal.roofarea.RoofAreaException;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Partitions a pixel grid into overlapping rectangular windows, so that a large raster can be processed tile by tile
 * with some context shared across tile boundaries.
 *
 * Windows start at every multiple of the stride (tile size minus overlap) below the grid dimension on each axis, and
 * are clipped to the grid. They are produced lazily in row-major order, y outer and x inner. Every call to iterator()
 * starts again from the top left window, so one TileWindower can be iterated several times or from several threads.
 */
public class TileWindower implements Iterable<Window> {

    public final int gridWidth;

    public final int gridHeight;

    public final int tileWidth;

    public final int tileHeight;

    public final int overlap;

    public TileWindower (int gridWidth, int gridHeight, int tileWidth, int tileHeight, int overlap) {
        if (gridWidth <= 0 || gridHeight <= 0) {
            throw RoofAreaException.configuration(
                    String.format("Grid dimensions must be positive, got %dx%d.", gridWidth, gridHeight));
        }
        if (tileWidth <= 0 || tileHeight <= 0) {
            throw RoofAreaException.configuration(
                    String.format("Tile dimensions must be positive, got %dx%d.", tileWidth, tileHeight));
        }
        if (overlap < 0) {
            throw RoofAreaException.configuration("Tile overlap must not be negative, got " + overlap + ".");
        }
        if (overlap >= tileWidth || overlap >= tileHeight) {
            throw RoofAreaException.configuration(String.format(
                    "Tile overlap must be smaller than tile dimensions, got overlap %d for %dx%d tiles.",
                    overlap, tileWidth, tileHeight));
        }
        this.gridWidth = gridWidth;
        this.gridHeight = gridHeight;
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
        this.overlap = overlap;
    }

    public static TileWindower square (int gridWidth, int gridHeight, int tileSize, int overlap) {
        return new TileWindower(gridWidth, gridHeight, tileSize, tileSize, overlap);
    }

    public static TileWindower forRaster (RasterGrid raster, int tileSize, int overlap) {
        return square(raster.width, raster.height, tileSize, overlap);
    }

    public int strideX () {
        return tileWidth - overlap;
    }

    public int strideY () {
        return tileHeight - overlap;
    }

    /** Number of windows on each axis is the count of stride multiples strictly below the grid dimension. */
    public int size () {
        return ceilDiv(gridWidth, strideX()) * ceilDiv(gridHeight, strideY());
    }

    private static int ceilDiv (int a, int b) {
        return (a + b - 1) / b;
    }

    public Stream<Window> stream () {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    public Iterator<Window> iterator () {
        return new Iterator<>() {
            int colOff = 0;
            int rowOff = 0;

            @Override
            public boolean hasNext () {
                return rowOff < gridHeight;
            }

            @Override
            public Window next () {
                if (!hasNext()) throw new NoSuchElementException();
                Window window = new Window(colOff, rowOff,
                        Math.min(tileWidth, gridWidth - colOff),
                        Math.min(tileHeight, gridHeight - rowOff));
                colOff += strideX();
                if (colOff >= gridWidth) {
                    colOff = 0;
                    rowOff += strideY();
                }
                return window;
            }
        };
    }

    @Override
    public String toString () {
        return String.format("TileWindower[grid %dx%d, tiles %dx%d, overlap %d]",
                gridWidth, gridHeight, tileWidth, tileHeight, overlap);
    }

}
