package com.conveyal.roofarea.pipeline;

import com.google.common.io.Files;

import java.nio.file.Path;

/**
 * Output file names derived from input file names when the user does not give them explicitly. Outputs land next to
 * their input, with the input's extension replaced by a descriptive suffix.
 */
public abstract class OutputPaths {

    public static final String MASK_SUFFIX = "_roof_mask.tif";

    public static final String REPORT_SUFFIX = "_eval_report.md";

    public static final String AREAS_SUFFIX = "_areas.csv";

    /** e.g. scenes/site.tif becomes scenes/site_roof_mask.tif */
    public static Path defaultMaskPath (Path rasterPath) {
        return withSuffix(rasterPath, MASK_SUFFIX);
    }

    /** e.g. scenes/site_roof_mask.tif becomes scenes/site_roof_mask_eval_report.md */
    public static Path defaultReportPath (Path predictedMaskPath) {
        return withSuffix(predictedMaskPath, REPORT_SUFFIX);
    }

    public static Path defaultAreasPath (Path vectorPath) {
        return withSuffix(vectorPath, AREAS_SUFFIX);
    }

    /** Replace the last extension of the file name (if any) with the given suffix, keeping the directory. */
    static Path withSuffix (Path path, String suffix) {
        String baseName = Files.getNameWithoutExtension(path.getFileName().toString());
        return path.resolveSibling(baseName + suffix);
    }

}
