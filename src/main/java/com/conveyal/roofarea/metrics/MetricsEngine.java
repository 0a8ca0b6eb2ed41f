package com.conveyal.roofarea.metrics;

import com.conveyal.roofarea.raster.BooleanMask;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Compares a predicted mask with a ground truth mask of the same shape. Overlap scores are computed on pixel counts,
 * areas by multiplying pixel counts with the ground area of one pixel.
 */
public abstract class MetricsEngine {

    /**
     * @param predicted mask produced by inference.
     * @param groundTruth rasterized ground truth, same shape as the prediction.
     * @param pixelArea area of one pixel, in square meters for metric grids. Must be finite and non-negative.
     */
    public static EvaluationMetrics compute (BooleanMask predicted, BooleanMask groundTruth, double pixelArea) {
        checkArgument(predicted.sameShape(groundTruth),
                "Predicted mask is %sx%s but ground truth is %sx%s.",
                predicted.width, predicted.height, groundTruth.width, groundTruth.height);
        checkArgument(pixelArea >= 0 && Double.isFinite(pixelArea), "Pixel area must be finite and non-negative.");
        int predictedCount = predicted.count();
        int truthCount = groundTruth.count();
        int intersection = predicted.and(groundTruth).count();
        int union = predictedCount + truthCount - intersection;
        double predArea = predictedCount * pixelArea;
        double gtArea = truthCount * pixelArea;
        double absError = Math.abs(predArea - gtArea);
        return new EvaluationMetrics(
                iou(intersection, union),
                dice(intersection, predictedCount + truthCount),
                predArea,
                gtArea,
                absError,
                relativeAreaError(absError, predArea, gtArea)
        );
    }

    /** Two empty masks agree perfectly. */
    static double iou (int intersection, int union) {
        return union == 0 ? 1.0 : (double) intersection / union;
    }

    static double dice (int intersection, int countSum) {
        return countSum == 0 ? 1.0 : 2.0 * intersection / countSum;
    }

    /**
     * Absolute error relative to the ground truth area. Without any ground truth area the ratio is undefined: it is
     * reported as zero if nothing was predicted either, and as positive infinity otherwise.
     */
    public static double relativeAreaError (double absAreaError, double predAreaM2, double gtAreaM2) {
        if (gtAreaM2 > 0) {
            return absAreaError / gtAreaM2;
        }
        return predAreaM2 == 0 ? 0.0 : Double.POSITIVE_INFINITY;
    }

}
