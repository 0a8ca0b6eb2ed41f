package com.conveyal.roofarea;

import ch.qos.logback.classic.Level;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.beust.jcommander.ParametersDelegate;
import com.conveyal.roofarea.common.Crs;
import com.conveyal.roofarea.common.DataSourceException;
import com.conveyal.roofarea.common.ExceptionUtils;
import com.conveyal.roofarea.metrics.AggregatedArea;
import com.conveyal.roofarea.metrics.AreaAggregator;
import com.conveyal.roofarea.pipeline.AreaOfInterest;
import com.conveyal.roofarea.pipeline.InferenceRequest;
import com.conveyal.roofarea.pipeline.InferenceResult;
import com.conveyal.roofarea.pipeline.MaskEvaluation;
import com.conveyal.roofarea.pipeline.OutputPaths;
import com.conveyal.roofarea.pipeline.RoofMaskInference;
import com.conveyal.roofarea.vector.GeoJsonFeatureReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point with three commands: infer (raster to roof mask), eval (roof mask against ground truth)
 * and aggregate (roof areas per building or tile). Every command accepts the common tuning options, which override
 * the configuration loaded by RoofAreaConfig.
 *
 * Exit status is 0 on success, 1 when the command failed for a reason explained in the log, and 2 when the command
 * line itself could not be understood.
 */
public abstract class RoofAreaMain {

    private static final Logger LOG = LoggerFactory.getLogger(RoofAreaMain.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    public static void main (String... args) {
        System.exit(run(args));
    }

    /** Parse and execute a command line, returning the process exit status instead of exiting. */
    public static int run (String... args) {
        InferCommand infer = new InferCommand();
        EvalCommand eval = new EvalCommand();
        AggregateCommand aggregate = new AggregateCommand();
        JCommander jc = JCommander.newBuilder()
                .programName("roof-area")
                .addCommand("infer", infer)
                .addCommand("eval", eval)
                .addCommand("aggregate", aggregate)
                .build();
        try {
            jc.parse(args);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            jc.usage();
            return EXIT_USAGE;
        }
        String commandName = jc.getParsedCommand();
        if (commandName == null) {
            jc.usage();
            return EXIT_USAGE;
        }
        Command command = (Command) jc.getCommands().get(commandName).getObjects().get(0);
        if (command.options().help) {
            jc.getUsageFormatter().usage(commandName);
            return EXIT_OK;
        }
        try {
            RoofAreaConfig config = command.options().loadConfig();
            applyLogLevel(config.logLevel());
            command.run(config);
            return EXIT_OK;
        } catch (RoofAreaException | DataSourceException | IOException | UncheckedIOException
                | IllegalArgumentException e) {
            LOG.error("Command {} failed: {}", commandName, ExceptionUtils.userMessage(e));
            LOG.debug("Stack trace:\n{}", ExceptionUtils.stackTraceString(e));
            return EXIT_FAILURE;
        }
    }

    /** Set the level of the root Logback logger, leaving more specific loggers alone. */
    static void applyLogLevel (String logLevel) {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (logLevel != null && root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.toLevel(logLevel, Level.INFO));
        }
    }

    /** One subcommand. Options are filled in by JCommander before run is called. */
    private interface Command {
        CommonOptions options ();
        void run (RoofAreaConfig config) throws IOException;
    }

    /** Tuning options accepted by every command, with the same names as the configuration keys. */
    static class CommonOptions {

        @Parameter(names = "--threshold", description = "Gradient threshold, a fraction of the strongest gradient")
        Double threshold;

        @Parameter(names = "--tile-size", description = "Tile size in pixels")
        Integer tileSize;

        @Parameter(names = "--overlap", description = "Tile overlap in pixels")
        Integer overlap;

        @Parameter(names = "--min-area-m2", description = "Minimum roof area in square meters")
        Double minAreaM2;

        @Parameter(names = "--seed", description = "Random seed")
        Long seed;

        @Parameter(names = "--log-level", description = "Logging level: TRACE, DEBUG, INFO, WARN, ERROR or OFF")
        String logLevel;

        @Parameter(names = "--config", description = "Properties file overriding the built-in defaults")
        Path configFile;

        @Parameter(names = { "-h", "--help" }, help = true, description = "Show usage of this command")
        boolean help;

        /** Only options actually given on the command line, keyed like the configuration properties. */
        Map<String, String> overrides () {
            Map<String, String> overrides = new LinkedHashMap<>();
            putIfPresent(overrides, "threshold", threshold);
            putIfPresent(overrides, "tile-size", tileSize);
            putIfPresent(overrides, "overlap", overlap);
            putIfPresent(overrides, "min-area-m2", minAreaM2);
            putIfPresent(overrides, "seed", seed);
            putIfPresent(overrides, "log-level", logLevel);
            return overrides;
        }

        private static void putIfPresent (Map<String, String> map, String key, Object value) {
            if (value != null) map.put(key, value.toString());
        }

        RoofAreaConfig loadConfig () {
            return RoofAreaConfig.load(configFile, overrides());
        }
    }

    @Parameters(commandDescription = "Detect roofs in a GeoTIFF and write a 0/1 roof mask GeoTIFF")
    static class InferCommand implements Command {

        @ParametersDelegate
        CommonOptions common = new CommonOptions();

        @Parameter(names = "--raster", required = true, description = "Input raster (GeoTIFF)")
        Path raster;

        @Parameter(names = "--footprints", description = "Building footprints (GeoJSON), required by the baseline")
        Path footprints;

        @Parameter(names = "--output", description = "Output mask path, by default next to the raster")
        Path output;

        @Parameter(names = "--model", description = "Trained model, selects learned model inference")
        Path model;

        @Parameter(names = "--aoi", description = "Only process the area of interest minx,miny,maxx,maxy")
        String aoi;

        @Parameter(names = "--aoi-crs", description = "CRS of the area of interest")
        String aoiCrs = Crs.WGS84;

        @Override
        public CommonOptions options () {
            return common;
        }

        @Override
        public void run (RoofAreaConfig config) throws IOException {
            Logger log = LoggerFactory.getLogger("com.conveyal.roofarea.infer");
            log.info("Running inference with settings: {}", config);
            InferenceRequest request = new InferenceRequest(raster, footprints).withConfig(config);
            request.outputPath = output;
            request.modelPath = model;
            if (aoi != null) {
                request.areaOfInterest = AreaOfInterest.parse(aoi, aoiCrs);
            }
            InferenceResult result = RoofMaskInference.run(request, log);
            log.debug("{}", result);
        }
    }

    @Parameters(commandDescription = "Evaluate a predicted roof mask against ground truth polygons")
    static class EvalCommand implements Command {

        @ParametersDelegate
        CommonOptions common = new CommonOptions();

        @Parameter(names = "--pred-mask", required = true, description = "Predicted mask (GeoTIFF)")
        Path predictedMask;

        @Parameter(names = "--ground-truth", required = true, description = "Ground truth polygons (GeoJSON)")
        Path groundTruth;

        @Parameter(names = "--report", description = "Output report path, by default next to the predicted mask")
        Path report;

        @Override
        public CommonOptions options () {
            return common;
        }

        @Override
        public void run (RoofAreaConfig config) throws IOException {
            Logger log = LoggerFactory.getLogger("com.conveyal.roofarea.eval");
            log.info("Running evaluation with settings: {}", config);
            MaskEvaluation.evaluateAndReport(predictedMask, groundTruth, report, log);
        }
    }

    @Parameters(commandDescription = "Sum roof areas per building_id, or per tile_id, and write them as CSV")
    static class AggregateCommand implements Command {

        @ParametersDelegate
        CommonOptions common = new CommonOptions();

        @Parameter(names = "--input", required = true, description = "Roof polygons (GeoJSON)")
        Path input;

        @Parameter(names = "--output", description = "Output CSV path, by default next to the input")
        Path output;

        @Override
        public CommonOptions options () {
            return common;
        }

        @Override
        public void run (RoofAreaConfig config) throws IOException {
            List<AggregatedArea> rows = AreaAggregator.aggregate(GeoJsonFeatureReader.read(input));
            Path csv = output != null ? output : OutputPaths.defaultAreasPath(input);
            AreaAggregator.writeCsv(rows, csv);
        }
    }

}
