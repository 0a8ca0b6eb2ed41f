package com.conveyal.roofarea.pipeline;

import java.nio.file.Path;

/** Summary of a finished inference run. The mask itself is in the output file. */
public final class InferenceResult {

    public final Path outputPath;

    public final InferenceMode mode;

    public final int roofPixels;

    /** Total roof area, in square units of the raster CRS (square meters for a metric CRS). */
    public final double roofAreaM2;

    public final double shadowScore;

    public final double edgeConfidence;

    /** True if a large share of the roof pixels are dark enough to suggest shadows. */
    public final boolean shadowFlagged;

    public InferenceResult (
            Path outputPath,
            InferenceMode mode,
            int roofPixels,
            double roofAreaM2,
            double shadowScore,
            double edgeConfidence,
            boolean shadowFlagged
    ) {
        this.outputPath = outputPath;
        this.mode = mode;
        this.roofPixels = roofPixels;
        this.roofAreaM2 = roofAreaM2;
        this.shadowScore = shadowScore;
        this.edgeConfidence = edgeConfidence;
        this.shadowFlagged = shadowFlagged;
    }

    @Override
    public String toString () {
        return String.format("InferenceResult{output=%s, mode=%s, roofPixels=%d, roofAreaM2=%s, shadowScore=%s, "
                        + "edgeConfidence=%s, shadowFlagged=%s}",
                outputPath, mode, roofPixels, roofAreaM2, shadowScore, edgeConfidence, shadowFlagged);
    }

}
