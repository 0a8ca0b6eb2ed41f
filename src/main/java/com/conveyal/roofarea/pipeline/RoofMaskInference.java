package com.conveyal.roofarea.pipeline;

import com.conveyal.roofarea.RoofAreaException;
import com.conveyal.roofarea.mask.FootprintConstrainer;
import com.conveyal.roofarea.mask.GradientMaskGenerator;
import com.conveyal.roofarea.metrics.AreaUtils;
import com.conveyal.roofarea.metrics.QualityMetrics;
import com.conveyal.roofarea.raster.BooleanMask;
import com.conveyal.roofarea.raster.GeoTiffReader;
import com.conveyal.roofarea.raster.GeoTiffWriter;
import com.conveyal.roofarea.raster.GridGeometry;
import com.conveyal.roofarea.raster.RasterGrid;
import com.conveyal.roofarea.raster.TileWindower;
import com.conveyal.roofarea.vector.FeatureCollection;
import com.conveyal.roofarea.vector.GeoJsonFeatureReader;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Produces a roof mask GeoTIFF from an aerial or satellite GeoTIFF.
 *
 * The heuristic baseline marks pixels with strong intensity gradients and keeps only those inside known building
 * footprints. Learned model inference is a recognized mode but is not implemented, and selecting it fails before any
 * input is read. All checks on the inputs happen before the mask is written, so a failed run leaves no output behind.
 */
public abstract class RoofMaskInference {

    public static final String MODEL_NOT_IMPLEMENTED_MESSAGE = "ML model inference is not implemented yet. "
            + "Omit --model to use the heuristic baseline or implement a UNet/DeepLab runner.";

    /** Byte imagery is scaled to [0, 1] before looking for dark pixels. */
    private static final double BYTE_MAX = 255;

    /**
     * @param log receives progress and quality messages, so callers can route them to their own logger.
     * @return a summary of the run, including where the mask was written.
     */
    public static InferenceResult run (InferenceRequest request, Logger log) throws IOException {
        checkNotNull(request, "Inference request must not be null.");
        switch (request.mode()) {
            case LEARNED_MODEL:
                throw RoofAreaException.unsupported(MODEL_NOT_IMPLEMENTED_MESSAGE);
            case HEURISTIC_BASELINE:
                return runBaseline(request, log);
            default:
                throw new IllegalStateException("Unknown inference mode " + request.mode());
        }
    }

    private static InferenceResult runBaseline (InferenceRequest request, Logger log) throws IOException {
        if (request.footprintsPath == null) {
            throw RoofAreaException.precondition(FootprintConstrainer.NO_FOOTPRINTS_MESSAGE);
        }
        checkNotNull(request.rasterPath, "A raster is required for inference.");
        Path outputPath = request.outputPath != null
                ? request.outputPath
                : OutputPaths.defaultMaskPath(request.rasterPath);

        RasterGrid raster = GeoTiffReader.read(request.rasterPath);
        if (request.areaOfInterest != null) {
            raster = raster.read(request.areaOfInterest.boundsIn(raster.crs()));
            log.info("Limited inference to {}x{} pixels within area of interest {}.",
                    raster.width, raster.height, request.areaOfInterest);
        }
        FeatureCollection footprints = GeoJsonFeatureReader.read(request.footprintsPath);
        TileWindower tiles = TileWindower.forRaster(raster, request.tileSize, request.overlap);

        double[] magnitude = GradientMaskGenerator.normalizedMagnitude(raster, tiles);
        BooleanMask gradientMask =
                GradientMaskGenerator.threshold(magnitude, raster.width, raster.height, request.threshold);
        BooleanMask roofMask = FootprintConstrainer.constrain(gradientMask, raster.geometry, footprints, log);

        GeoTiffWriter.writeMask(roofMask, raster.geometry, outputPath);
        log.info("Baseline inference saved mask to {}", outputPath);

        return summarize(outputPath, raster, magnitude, roofMask, request, log);
    }

    /** Compute and log the area and quality diagnostics of a finished mask. */
    private static InferenceResult summarize (Path outputPath, RasterGrid raster, double[] magnitude,
                                              BooleanMask roofMask, InferenceRequest request, Logger log) {
        GridGeometry grid = raster.geometry;
        double roofArea = AreaUtils.maskAreaM2(roofMask, grid);
        if (grid.crs == null || !grid.crs.isMetric()) {
            log.warn("Raster CRS {} is not metric, roof area is in squared CRS units.", grid.crs);
        }
        if (roofArea < request.minAreaM2) {
            log.warn("Total roof area {} m² is below the minimum of {} m².", roofArea, request.minAreaM2);
        }

        double[] intensity = GradientMaskGenerator.intensity(raster);
        double max = 0;
        for (double value : intensity) max = Math.max(max, value);
        if (max > 1) {
            for (int i = 0; i < intensity.length; i++) intensity[i] /= BYTE_MAX;
        }
        double[] probability = new double[magnitude.length];
        for (int i = 0; i < magnitude.length; i++) {
            probability[i] = magnitude[i] / GradientMaskGenerator.MAX_MAGNITUDE;
        }
        double shadowScore = QualityMetrics.shadowScore(new RasterGrid(grid, intensity), roofMask);
        double edgeConfidence = QualityMetrics.edgeConfidence(new RasterGrid(grid, probability), roofMask);
        boolean shadowFlagged = QualityMetrics.shadowFlag(shadowScore);
        log.info("Roof mask has {} pixels ({} m²), shadow score {}, edge confidence {}.",
                roofMask.count(), roofArea, shadowScore, edgeConfidence);
        if (shadowFlagged) {
            log.warn("Roof mask is flagged as shadowed, {} of its pixels are dark.", shadowScore);
        }
        return new InferenceResult(outputPath, InferenceMode.HEURISTIC_BASELINE, roofMask.count(), roofArea,
                shadowScore, edgeConfidence, shadowFlagged);
    }

}
