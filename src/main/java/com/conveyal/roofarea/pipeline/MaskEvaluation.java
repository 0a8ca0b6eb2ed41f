package com.conveyal.roofarea.pipeline;

import com.conveyal.roofarea.mask.GroundTruthRasterizer;
import com.conveyal.roofarea.metrics.EvaluationMetrics;
import com.conveyal.roofarea.metrics.EvaluationReport;
import com.conveyal.roofarea.metrics.MetricsEngine;
import com.conveyal.roofarea.raster.BooleanMask;
import com.conveyal.roofarea.raster.GeoTiffReader;
import com.conveyal.roofarea.raster.RasterGrid;
import com.conveyal.roofarea.vector.FeatureCollection;
import com.conveyal.roofarea.vector.GeoJsonFeatureReader;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Compares a predicted roof mask with vector ground truth. The ground truth is rasterized onto the grid of the
 * predicted mask, so both are compared pixel for pixel, and areas are derived from the ground area of one pixel of
 * that grid.
 */
public abstract class MaskEvaluation {

    /** Any nonzero value in the first band of the predicted mask raster counts as roof. */
    public static EvaluationMetrics evaluate (Path predictedMaskPath, Path groundTruthPath, Logger log)
            throws IOException {
        RasterGrid predicted = GeoTiffReader.read(predictedMaskPath);
        FeatureCollection groundTruth = GeoJsonFeatureReader.read(groundTruthPath);
        return evaluate(predicted, groundTruth, log);
    }

    public static EvaluationMetrics evaluate (RasterGrid predicted, FeatureCollection groundTruth, Logger log) {
        if (predicted.crs() != null && !predicted.crs().isMetric()) {
            log.warn("Predicted mask CRS {} is not metric, areas will be in squared CRS units.", predicted.crs());
        }
        BooleanMask predictedMask = BooleanMask.fromBand(predicted, 0);
        BooleanMask truthMask = GroundTruthRasterizer.rasterize(predicted.geometry, groundTruth);
        EvaluationMetrics metrics = MetricsEngine.compute(predictedMask, truthMask, predicted.geometry.pixelArea());
        log.info("Evaluated {} predicted against {} ground truth roof pixels: {}",
                predictedMask.count(), truthMask.count(), metrics);
        return metrics;
    }

    /**
     * Evaluate and write a Markdown report.
     * @param reportPath where to write the report, or null to put it next to the predicted mask.
     * @return the path of the written report.
     */
    public static Path evaluateAndReport (Path predictedMaskPath, Path groundTruthPath, Path reportPath, Logger log)
            throws IOException {
        EvaluationMetrics metrics = evaluate(predictedMaskPath, groundTruthPath, log);
        Path report = reportPath != null ? reportPath : OutputPaths.defaultReportPath(predictedMaskPath);
        EvaluationReport.write(metrics, report);
        log.info("Evaluation report saved to {}", report);
        return report;
    }

}
