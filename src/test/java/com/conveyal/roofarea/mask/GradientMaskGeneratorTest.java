package com.conveyal.roofarea.mask;

import com.conveyal.roofarea.RasterFixtures;
import com.conveyal.roofarea.raster.BooleanMask;
import com.conveyal.roofarea.raster.GridGeometry;
import com.conveyal.roofarea.raster.RasterGrid;
import com.conveyal.roofarea.raster.TileWindower;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GradientMaskGeneratorTest {

    @Test
    public void flatImageHasNoRoofs () {
        GridGeometry grid = RasterFixtures.originGrid(8, 6, 0, 6, 1, "EPSG:3857");
        double[] band = new double[48];
        Arrays.fill(band, 120);
        RasterGrid flat = new RasterGrid(grid, band);
        assertTrue(GradientMaskGenerator.generate(flat, 0).isEmpty());
        assertTrue(GradientMaskGenerator.generate(flat, 0.5).isEmpty());
    }

    @Test
    public void edgesOfBrightSquare () {
        RasterGrid image = RasterFixtures.brightSquare();
        BooleanMask mask = GradientMaskGenerator.generate(image, 0.5);
        assertFalse(mask.isEmpty());
        assertFalse(mask.get(0, 0));
        assertFalse(mask.get(9, 9));
        // The square is symmetric, so is its gradient.
        for (int row = 0; row < 10; row++) {
            for (int col = 0; col < 10; col++) {
                assertEquals(mask.get(col, row), mask.get(9 - col, row));
                assertEquals(mask.get(col, row), mask.get(col, 9 - row));
                assertEquals(mask.get(col, row), mask.get(row, col));
            }
        }
        double[] magnitude = GradientMaskGenerator.normalizedMagnitude(image, null);
        assertEquals(GradientMaskGenerator.MAX_MAGNITUDE, Arrays.stream(magnitude).max().getAsDouble(), 1e-9);
    }

    @Test
    public void higherThresholdSelectsFewerPixels () {
        RasterGrid image = RasterFixtures.brightSquare();
        int previous = Integer.MAX_VALUE;
        for (double threshold = -0.5; threshold <= 1.5; threshold += 0.1) {
            int count = GradientMaskGenerator.generate(image, threshold).count();
            assertTrue(count <= previous, "Count grew at threshold " + threshold);
            previous = count;
        }
        // Nothing is strictly above the maximum, and thresholds are clipped to [0, 1].
        assertTrue(GradientMaskGenerator.generate(image, 1).isEmpty());
        assertTrue(GradientMaskGenerator.generate(image, 7).isEmpty());
        assertEquals(GradientMaskGenerator.generate(image, 0), GradientMaskGenerator.generate(image, -3));
    }

    @Test
    public void tiledMatchesUntiled () {
        Random random = new Random(42);
        int width = 37;
        int height = 29;
        double[] band = new double[width * height];
        for (int i = 0; i < band.length; i++) {
            band[i] = random.nextInt(256);
        }
        RasterGrid image = new RasterGrid(RasterFixtures.originGrid(width, height, 0, 29, 1, "EPSG:3857"), band);
        TileWindower tiles = TileWindower.forRaster(image, 16, 8);
        assertTrue(GradientMaskGenerator.supportsTiling(tiles));

        double[] whole = GradientMaskGenerator.normalizedMagnitude(image, null);
        double[] tiled = GradientMaskGenerator.normalizedMagnitude(image, tiles);
        assertArrayEquals(whole, tiled, 1e-9);
        assertEquals(GradientMaskGenerator.generate(image, 0.3), GradientMaskGenerator.generate(image, 0.3, tiles));
    }

    @Test
    public void narrowOverlapFallsBackToWholeImage () {
        RasterGrid image = RasterFixtures.brightSquare();
        TileWindower tiles = TileWindower.forRaster(image, 4, 1);
        assertFalse(GradientMaskGenerator.supportsTiling(tiles));
        assertEquals(GradientMaskGenerator.generate(image, 0.4), GradientMaskGenerator.generate(image, 0.4, tiles));
    }

    @Test
    public void intensityAveragesColorBands () {
        GridGeometry grid = RasterFixtures.originGrid(2, 1, 0, 1, 1, null);
        RasterGrid rgba = new RasterGrid(grid, new double[] { 3, 0 }, new double[] { 6, 0 }, new double[] { 9, 3 },
                new double[] { 255, 255 });
        assertArrayEquals(new double[] { 6, 1 }, GradientMaskGenerator.intensity(rgba), 1e-12);
        RasterGrid single = new RasterGrid(grid, new double[] { 7, 8 });
        assertArrayEquals(new double[] { 7, 8 }, GradientMaskGenerator.intensity(single), 0);
    }

    /** Borders mirror the image without repeating the edge pixel, so a linear ramp has no gradient at its ends. */
    @Test
    public void rampHasNoGradientAtMirroredBorders () {
        int width = 9;
        int height = 4;
        double[] band = new double[width * height];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                band[row * width + col] = col * 8;
            }
        }
        double[] magnitude = GradientMaskGenerator.gradientMagnitude(band, width, height);
        for (int row = 0; row < height; row++) {
            assertEquals(0, magnitude[row * width], 1e-9);
            assertEquals(0, magnitude[row * width + width - 1], 1e-9);
            // Away from the borders the blur leaves the ramp intact and Sobel reads 8 * (1 + 2 + 1) * 2.
            assertEquals(64, magnitude[row * width + 4], 1e-9);
        }
    }

    /** A vertical step from 0 to 16 has its strongest horizontal gradient on the two columns beside the step. */
    @Test
    public void stepEdgeLocation () {
        int width = 8;
        int height = 5;
        double[] band = new double[width * height];
        for (int row = 0; row < height; row++) {
            for (int col = 4; col < width; col++) {
                band[row * width + col] = 16;
            }
        }
        double[] magnitude = GradientMaskGenerator.gradientMagnitude(band, width, height);
        for (int row = 0; row < height; row++) {
            double left = magnitude[row * width + 3];
            double right = magnitude[row * width + 4];
            assertEquals(left, right, 1e-9);
            assertTrue(left > magnitude[row * width + 2]);
            assertEquals(0, magnitude[row * width], 1e-9);
        }
    }

}
