package com.conveyal.roofarea.raster;

import java.util.BitSet;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A binary raster of width x height pixels, as produced by the mask generators and rasterizers and consumed by the
 * metrics. Bits are stored row-major in a BitSet, pixel (col, row) at index row * width + col.
 *
 * Masks are mutable only through set(), which is meant for filling a freshly created mask. The combining operations
 * (and, or) always return new masks and leave both operands untouched.
 */
public class BooleanMask {

    public final int width;

    public final int height;

    private final BitSet bits;

    public BooleanMask (int width, int height) {
        this(width, height, new BitSet(width * height));
    }

    private BooleanMask (int width, int height, BitSet bits) {
        checkArgument(width > 0 && height > 0, "Mask dimensions must be positive, got %sx%s.", width, height);
        this.width = width;
        this.height = height;
        this.bits = bits;
    }

    /** An empty mask with the same shape as the given grid. */
    public static BooleanMask empty (GridGeometry geometry) {
        return new BooleanMask(geometry.width, geometry.height);
    }

    /**
     * Build a mask from strings, one per row, where '#' or '1' marks a true pixel and anything else a false one.
     * Handy for writing small masks in tests and examples.
     */
    public static BooleanMask parse (String... rows) {
        checkArgument(rows.length > 0, "At least one row is required.");
        BooleanMask mask = new BooleanMask(rows[0].length(), rows.length);
        for (int row = 0; row < rows.length; row++) {
            checkArgument(rows[row].length() == mask.width, "All rows must have the same length.");
            for (int col = 0; col < mask.width; col++) {
                char c = rows[row].charAt(col);
                mask.set(col, row, c == '#' || c == '1');
            }
        }
        return mask;
    }

    public boolean get (int col, int row) {
        return bits.get(index(col, row));
    }

    /** Get by flattened row-major index. */
    public boolean get (int index) {
        return bits.get(index);
    }

    public void set (int col, int row, boolean value) {
        bits.set(index(col, row), value);
    }

    /** Set a run of pixels within one row, from fromCol inclusive to toCol exclusive. */
    public void setRange (int row, int fromCol, int toCol) {
        if (toCol <= fromCol) return;
        bits.set(index(fromCol, row), index(toCol - 1, row) + 1);
    }

    private int index (int col, int row) {
        if (col < 0 || col >= width || row < 0 || row >= height) {
            throw new IndexOutOfBoundsException(String.format("Pixel (%d, %d) outside %dx%d mask.", col, row, width, height));
        }
        return row * width + col;
    }

    public int pixelCount () {
        return width * height;
    }

    /** Number of true pixels. */
    public int count () {
        return bits.cardinality();
    }

    public boolean isEmpty () {
        return bits.isEmpty();
    }

    public boolean sameShape (BooleanMask other) {
        return width == other.width && height == other.height;
    }

    public boolean sameShape (GridGeometry geometry) {
        return width == geometry.width && height == geometry.height;
    }

    private void checkSameShape (BooleanMask other) {
        checkArgument(sameShape(other), "Mask shapes differ: %sx%s and %sx%s.", width, height, other.width, other.height);
    }

    /** @return a new mask true where both this and the other mask are true. */
    public BooleanMask and (BooleanMask other) {
        checkSameShape(other);
        BitSet result = (BitSet) bits.clone();
        result.and(other.bits);
        return new BooleanMask(width, height, result);
    }

    /** @return a new mask true where either this or the other mask is true. */
    public BooleanMask or (BooleanMask other) {
        checkSameShape(other);
        BitSet result = (BitSet) bits.clone();
        result.or(other.bits);
        return new BooleanMask(width, height, result);
    }

    public BooleanMask copy () {
        return new BooleanMask(width, height, (BitSet) bits.clone());
    }

    /** Samples of this mask as bytes, 1 for true and 0 for false, row-major. */
    public byte[] toBytes () {
        byte[] bytes = new byte[pixelCount()];
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            bytes[i] = 1;
        }
        return bytes;
    }

    /** Interpret a single band of samples as a mask: any nonzero sample is true. */
    public static BooleanMask fromBand (RasterGrid raster, int band) {
        BooleanMask mask = new BooleanMask(raster.width, raster.height);
        double[] samples = raster.band(band);
        for (int i = 0; i < samples.length; i++) {
            if (samples[i] != 0) mask.bits.set(i);
        }
        return mask;
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (other == null || getClass() != other.getClass()) return false;
        BooleanMask that = (BooleanMask) other;
        return width == that.width && height == that.height && bits.equals(that.bits);
    }

    @Override
    public int hashCode () {
        return Objects.hash(width, height, bits);
    }

    /** Rows of '#' and '.', the inverse of parse(). */
    @Override
    public String toString () {
        StringBuilder builder = new StringBuilder();
        for (int row = 0; row < height; row++) {
            if (row > 0) builder.append('\n');
            for (int col = 0; col < width; col++) {
                builder.append(get(col, row) ? '#' : '.');
            }
        }
        return builder.toString();
    }

}
