package com.conveyal.roofarea.metrics;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Renders evaluation metrics as a short Markdown document. Numbers have four decimal places with a period as the
 * decimal separator whatever the default locale, and an infinite relative error is written as "inf".
 */
public abstract class EvaluationReport {

    public static final String TITLE = "# Roof Area Evaluation Report";

    public static String format (EvaluationMetrics metrics) {
        return String.join("\n",
                TITLE,
                "",
                "## Metrics",
                "- IoU: " + formatMetric(metrics.iou),
                "- Dice: " + formatMetric(metrics.dice),
                "- Predicted area (m²): " + formatMetric(metrics.predAreaM2),
                "- Ground truth area (m²): " + formatMetric(metrics.gtAreaM2),
                "- Absolute area error (m²): " + formatMetric(metrics.absAreaError),
                "- Relative area error: " + formatMetric(metrics.relAreaError),
                ""
        );
    }

    static String formatMetric (double value) {
        if (Double.isInfinite(value)) {
            return "inf";
        }
        return String.format(Locale.ROOT, "%.4f", value);
    }

    /** Write the report as UTF-8, creating parent directories as needed. */
    public static Path write (EvaluationMetrics metrics, Path reportFile) throws IOException {
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(reportFile, format(metrics), StandardCharsets.UTF_8);
        return reportFile;
    }

}
