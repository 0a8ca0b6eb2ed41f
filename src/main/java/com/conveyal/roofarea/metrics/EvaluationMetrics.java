package com.conveyal.roofarea.metrics;

import java.util.Objects;

/**
 * Agreement between a predicted roof mask and ground truth. Areas are in square meters when the masks are on a
 * metric grid. The relative area error is positive infinity when there is no ground truth area but some predicted
 * area, so consumers must be ready for a non-finite value there.
 */
public final class EvaluationMetrics {

    public final double iou;

    public final double dice;

    public final double predAreaM2;

    public final double gtAreaM2;

    public final double absAreaError;

    public final double relAreaError;

    public EvaluationMetrics (
            double iou,
            double dice,
            double predAreaM2,
            double gtAreaM2,
            double absAreaError,
            double relAreaError
    ) {
        this.iou = iou;
        this.dice = dice;
        this.predAreaM2 = predAreaM2;
        this.gtAreaM2 = gtAreaM2;
        this.absAreaError = absAreaError;
        this.relAreaError = relAreaError;
    }

    @Override
    public boolean equals (Object other) {
        if (this == other) return true;
        if (other == null || getClass() != other.getClass()) return false;
        EvaluationMetrics that = (EvaluationMetrics) other;
        return Double.compare(iou, that.iou) == 0
                && Double.compare(dice, that.dice) == 0
                && Double.compare(predAreaM2, that.predAreaM2) == 0
                && Double.compare(gtAreaM2, that.gtAreaM2) == 0
                && Double.compare(absAreaError, that.absAreaError) == 0
                && Double.compare(relAreaError, that.relAreaError) == 0;
    }

    @Override
    public int hashCode () {
        return Objects.hash(iou, dice, predAreaM2, gtAreaM2, absAreaError, relAreaError);
    }

    @Override
    public String toString () {
        return String.format(
                "EvaluationMetrics{iou=%s, dice=%s, predAreaM2=%s, gtAreaM2=%s, absAreaError=%s, relAreaError=%s}",
                iou, dice, predAreaM2, gtAreaM2, absAreaError, relAreaError
        );
    }

}
