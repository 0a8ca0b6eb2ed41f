package com.conveyal.roofarea.raster;

import java.util.Objects;

/**
 * A rectangular sub-region of a raster's pixel grid. Equals and hashcode are semantic, for use as or within hashtable
 * keys. Offsets and sizes are not checked against any particular grid on construction: windows produced by the
 * TileWindower and GridGeometry are already clipped to their grid.
 */
public final class Window {

    /** Column of the westernmost (leftmost) pixel. */
    public final int colOff;

    /** Row of the topmost pixel. Rows increase downward. */
    public final int rowOff;

    /** Width in pixels. */
    public final int width;

    /** Height in pixels. */
    public final int height;

    public Window (int colOff, int rowOff, int width, int height) {
        this.colOff = colOff;
        this.rowOff = rowOff;
        this.width = width;
        this.height = height;
    }

    /** True if this window lies entirely within a grid of the given dimensions. */
    public boolean fitsWithin (int gridWidth, int gridHeight) {
        return colOff >= 0 && rowOff >= 0 && width > 0 && height > 0
                && colOff + width <= gridWidth && rowOff + height <= gridHeight;
    }

    public int pixelCount () {
        return width * height;
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (other == null || getClass() != other.getClass()) return false;
        Window window = (Window) other;
        return colOff == window.colOff && rowOff == window.rowOff && width == window.width && height == window.height;
    }

    @Override
    public int hashCode () {
        return Objects.hash(colOff, rowOff, width, height);
    }

    @Override
    public String toString () {
        return String.format("Window[col=%d, row=%d, width=%d, height=%d]", colOff, rowOff, width, height);
    }

}
