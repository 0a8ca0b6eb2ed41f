package com.conveyal.roofarea.metrics;

import com.conveyal.roofarea.raster.BooleanMask;
import com.conveyal.roofarea.raster.RasterGrid;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Diagnostics for a single roof mask, used to flag results that deserve a second look. They need no ground truth:
 * the shadow score looks at how dark the image is under the mask, the edge confidence at how sure the detector was
 * along the outline of the mask.
 */
public abstract class QualityMetrics {

    /** Intensity at or below which a pixel counts as dark, for intensities scaled to [0, 1]. */
    public static final double DEFAULT_DARKNESS_THRESHOLD = 0.3;

    /** Shadow score at or above which a roof is flagged as shadowed. */
    public static final double DEFAULT_SHADOW_FLAG_THRESHOLD = 0.4;

    public static double shadowScore (RasterGrid image, BooleanMask mask) {
        return shadowScore(image, mask, DEFAULT_DARKNESS_THRESHOLD);
    }

    /**
     * Fraction of masked pixels whose intensity (the mean over all bands) is at or below the darkness threshold.
     * Zero when the mask is empty.
     */
    public static double shadowScore (RasterGrid image, BooleanMask mask, double darknessThreshold) {
        checkArgument(mask.width == image.width && mask.height == image.height, "Image and mask shapes differ.");
        int masked = 0;
        int dark = 0;
        for (int i = 0; i < mask.pixelCount(); i++) {
            if (!mask.get(i)) continue;
            double sum = 0;
            for (int b = 0; b < image.bandCount(); b++) {
                sum += image.band(b)[i];
            }
            masked += 1;
            if (sum / image.bandCount() <= darknessThreshold) {
                dark += 1;
            }
        }
        return masked == 0 ? 0.0 : (double) dark / masked;
    }

    /**
     * Mean probability along the edge of the mask. Edge pixels are true pixels with at least one false 4-neighbor,
     * where neighbors outside the grid count as false. Zero when the mask has no edge pixels.
     *
     * @param probability single band, same shape as the mask. Only band 0 is used.
     */
    public static double edgeConfidence (RasterGrid probability, BooleanMask mask) {
        checkArgument(mask.width == probability.width && mask.height == probability.height,
                "Probability and mask shapes differ.");
        double[] values = probability.band(0);
        double sum = 0;
        int edgeCount = 0;
        for (int row = 0; row < mask.height; row++) {
            for (int col = 0; col < mask.width; col++) {
                if (isEdge(mask, col, row)) {
                    sum += values[row * mask.width + col];
                    edgeCount += 1;
                }
            }
        }
        return edgeCount == 0 ? 0.0 : sum / edgeCount;
    }

    static boolean isEdge (BooleanMask mask, int col, int row) {
        if (!mask.get(col, row)) return false;
        return !(isSet(mask, col, row - 1) && isSet(mask, col, row + 1)
                && isSet(mask, col - 1, row) && isSet(mask, col + 1, row));
    }

    private static boolean isSet (BooleanMask mask, int col, int row) {
        return col >= 0 && col < mask.width && row >= 0 && row < mask.height && mask.get(col, row);
    }

    public static boolean shadowFlag (double shadowScore) {
        return shadowFlag(shadowScore, DEFAULT_SHADOW_FLAG_THRESHOLD);
    }

    public static boolean shadowFlag (double shadowScore, double threshold) {
        return shadowScore >= threshold;
    }

}
