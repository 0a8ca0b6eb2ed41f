package com.conveyal.roofarea.metrics;

import com.conveyal.roofarea.RasterFixtures;
import com.conveyal.roofarea.raster.BooleanMask;
import com.conveyal.roofarea.raster.GridGeometry;
import com.conveyal.roofarea.raster.RasterGrid;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QualityMetricsTest {

    private static final GridGeometry GRID = RasterFixtures.originGrid(5, 5, 0, 5, 1, "EPSG:3857");

    private static final BooleanMask SQUARE = BooleanMask.parse(
            ".....",
            ".###.",
            ".###.",
            ".###.",
            "....."
    );

    /** The eight outer pixels of a 3x3 square are its edge, the center pixel is not. */
    @Test
    public void edgeConfidence () {
        double[] probability = new double[25];
        Arrays.fill(probability, 0.95);
        // Every edge pixel has its own value, so the mean covers exactly these eight.
        int[] edge = { 6, 7, 8, 11, 13, 16, 17, 18 };
        double[] values = { 0.2, 0.3, 0.4, 0.5, 0.6, 0.7, 0.8, 0.1 };
        for (int i = 0; i < edge.length; i++) {
            probability[edge[i]] = values[i];
        }
        probability[12] = 0.9;
        assertEquals(3.6 / 8, QualityMetrics.edgeConfidence(new RasterGrid(GRID, probability), SQUARE), 1e-12);
        assertTrue(QualityMetrics.isEdge(SQUARE, 1, 1));
        assertFalse(QualityMetrics.isEdge(SQUARE, 2, 2));
        assertFalse(QualityMetrics.isEdge(SQUARE, 0, 0));
        assertEquals(0, QualityMetrics.edgeConfidence(new RasterGrid(GRID, probability), new BooleanMask(5, 5)), 0);
    }

    @Test
    public void gridBorderIsAnEdge () {
        BooleanMask full = BooleanMask.parse("###", "###", "###");
        assertTrue(QualityMetrics.isEdge(full, 0, 1));
        assertFalse(QualityMetrics.isEdge(full, 1, 1));
        double[] probability = { 0.5, 0.5, 0.5, 0.5, 0, 0.5, 0.5, 0.5, 0.5 };
        GridGeometry grid = RasterFixtures.originGrid(3, 3, 0, 3, 1, null);
        assertEquals(0.5, QualityMetrics.edgeConfidence(new RasterGrid(grid, probability), full), 1e-12);
    }

    @Test
    public void darkerImagesScoreHigher () {
        double[] bright = new double[25];
        double[] dim = new double[25];
        double[] dark = new double[25];
        Arrays.fill(bright, 0.9);
        Arrays.fill(dim, 0.9);
        Arrays.fill(dark, 0.1);
        // Three of the nine masked pixels of the dim image are in shadow.
        dim[6] = 0.2;
        dim[7] = 0.3;
        dim[8] = 0.25;
        double brightScore = QualityMetrics.shadowScore(new RasterGrid(GRID, bright), SQUARE);
        double dimScore = QualityMetrics.shadowScore(new RasterGrid(GRID, dim), SQUARE);
        double darkScore = QualityMetrics.shadowScore(new RasterGrid(GRID, dark), SQUARE);
        assertEquals(0, brightScore, 0);
        assertEquals(1.0 / 3, dimScore, 1e-12);
        assertEquals(1, darkScore, 0);
        assertFalse(QualityMetrics.shadowFlag(dimScore));
        assertTrue(QualityMetrics.shadowFlag(darkScore));
        assertTrue(QualityMetrics.shadowFlag(0.4));
        assertTrue(QualityMetrics.shadowFlag(dimScore, 0.3));
        assertEquals(0, QualityMetrics.shadowScore(new RasterGrid(GRID, dark), new BooleanMask(5, 5)), 0);
    }

    @Test
    public void shadowUsesMeanOverBands () {
        double[] red = new double[25];
        double[] green = new double[25];
        Arrays.fill(red, 0.5);
        Arrays.fill(green, 0.0);
        // Mean 0.25 is dark.
        RasterGrid image = new RasterGrid(GRID, red, green);
        assertEquals(1, QualityMetrics.shadowScore(image, SQUARE), 0);
        assertEquals(0, QualityMetrics.shadowScore(image, SQUARE, 0.2), 0);
    }

}
