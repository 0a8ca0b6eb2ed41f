package com.conveyal.roofarea.pipeline;

import com.conveyal.roofarea.RoofAreaConfig;

import java.nio.file.Path;

/**
 * Everything needed to produce one roof mask. Fields are public and mutable to keep call sites readable, in the
 * manner of a parameter object filled in field by field from the command line.
 */
public class InferenceRequest {

    /** GeoTIFF to detect roofs in. Required. */
    public Path rasterPath;

    /** GeoJSON building footprints. Required by the heuristic baseline. */
    public Path footprintsPath;

    /** Where to write the mask. Null means next to the raster, see OutputPaths. */
    public Path outputPath;

    /** A trained model. When set, selects learned model inference. */
    public Path modelPath;

    /** Optional bounds limiting the part of the raster that is processed. */
    public AreaOfInterest areaOfInterest;

    public double threshold = 0.5;

    public int tileSize = 512;

    public int overlap = 32;

    /** Total roof area below which the result is reported as suspiciously small. */
    public double minAreaM2 = 5.0;

    public InferenceRequest () { }

    public InferenceRequest (Path rasterPath, Path footprintsPath) {
        this.rasterPath = rasterPath;
        this.footprintsPath = footprintsPath;
    }

    /** Copy the tunable parameters from the configuration, leaving all paths untouched. */
    public InferenceRequest withConfig (RoofAreaConfig config) {
        this.threshold = config.threshold();
        this.tileSize = config.tileSize();
        this.overlap = config.overlap();
        this.minAreaM2 = config.minAreaM2();
        return this;
    }

    public InferenceMode mode () {
        return InferenceMode.forModelPath(modelPath);
    }

    @Override
    public String toString () {
        return String.format("InferenceRequest{raster=%s, footprints=%s, output=%s, model=%s, aoi=%s, " +
                        "threshold=%s, tileSize=%d, overlap=%d, minAreaM2=%s}",
                rasterPath, footprintsPath, outputPath, modelPath, areaOfInterest,
                threshold, tileSize, overlap, minAreaM2);
    }

}
