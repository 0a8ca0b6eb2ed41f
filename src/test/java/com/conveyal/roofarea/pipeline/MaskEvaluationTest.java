package com.conveyal.roofarea.pipeline;

import com.conveyal.roofarea.RasterFixtures;
import com.conveyal.roofarea.common.Crs;
import com.conveyal.roofarea.metrics.EvaluationMetrics;
import com.conveyal.roofarea.metrics.EvaluationReport;
import com.conveyal.roofarea.raster.BooleanMask;
import com.conveyal.roofarea.raster.GeoTiffWriter;
import com.conveyal.roofarea.raster.RasterGrid;
import com.conveyal.roofarea.vector.Feature;
import com.conveyal.roofarea.vector.FeatureCollection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.conveyal.roofarea.common.GeometryUtils.box;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MaskEvaluationTest {

    private static final Logger LOG = LoggerFactory.getLogger(MaskEvaluationTest.class);

    @TempDir
    Path tempDir;

    @Test
    public void perfectPrediction () throws Exception {
        RasterGrid square = RasterFixtures.brightSquare();
        Path maskFile = tempDir.resolve("pred.tif");
        GeoTiffWriter.writeMask(BooleanMask.fromBand(square, 0), square.geometry, maskFile);

        Path report = MaskEvaluation.evaluateAndReport(maskFile,
                RasterFixtures.resource("ground-truth-3857.geojson"), null, LOG);
        assertEquals(tempDir.resolve("pred_eval_report.md"), report);
        String text = Files.readString(report, StandardCharsets.UTF_8);
        assertTrue(text.startsWith(EvaluationReport.TITLE + "\n\n## Metrics\n"));
        assertTrue(text.contains("- IoU: 1.0000\n"));
        assertTrue(text.contains("- Predicted area (m²): 16.0000\n"));
        assertTrue(text.contains("- Relative area error: 0.0000\n"));
    }

    @Test
    public void partialOverlapInMemory () {
        RasterGrid square = RasterFixtures.brightSquare();
        // Ground truth covers columns 5 to 8 of rows 3 to 6: half of it overlaps the predicted square.
        FeatureCollection truth = FeatureCollection.of(Crs.WEB_MERCATOR, new Feature(box(5, 3, 9, 7)));
        EvaluationMetrics metrics = MaskEvaluation.evaluate(square, truth, LOG);
        assertEquals(8.0 / 24, metrics.iou, 1e-12);
        assertEquals(0.5, metrics.dice, 1e-12);
        assertEquals(16, metrics.predAreaM2, 1e-12);
        assertEquals(16, metrics.gtAreaM2, 1e-12);
        assertEquals(0, metrics.relAreaError, 1e-12);
    }

    @Test
    public void noGroundTruth () throws Exception {
        RasterGrid square = RasterFixtures.brightSquare();
        EvaluationMetrics metrics = MaskEvaluation.evaluate(square, FeatureCollection.of(Crs.WEB_MERCATOR), LOG);
        assertEquals(0, metrics.iou, 0);
        assertEquals(Double.POSITIVE_INFINITY, metrics.relAreaError);

        Path maskFile = tempDir.resolve("pred.tif");
        GeoTiffWriter.write(square, maskFile);
        Path truthFile = tempDir.resolve("empty.geojson");
        Files.writeString(truthFile, "{\"type\": \"FeatureCollection\", \"features\": []}", StandardCharsets.UTF_8);
        Path report = MaskEvaluation.evaluateAndReport(maskFile, truthFile, tempDir.resolve("out/report.md"), LOG);
        assertTrue(Files.readString(report, StandardCharsets.UTF_8).contains("- Relative area error: inf\n"));
    }

}
