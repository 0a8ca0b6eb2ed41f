package com.conveyal.roofarea.mask;

import com.conveyal.roofarea.raster.BooleanMask;
import com.conveyal.roofarea.raster.RasterGrid;
import com.conveyal.roofarea.raster.TileWindower;
import com.conveyal.roofarea.raster.Window;
import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The heuristic roof detector: roof outlines and ridges show up as strong intensity gradients. The image is reduced
 * to a single intensity band, smoothed with a 5x5 Gaussian, differentiated with 3x3 Sobel operators, and the
 * gradient magnitude is rescaled so its maximum is 255. Pixels whose rescaled magnitude is strictly greater than
 * threshold * 255 are marked true.
 *
 * The filtering is done by OpenCV in double precision. All filters use "reflect 101" borders, mirroring the image
 * about its edge pixels without repeating them (for a row a b c d the left border reads c b | a b c d).
 *
 * The magnitude can be computed tile by tile. Each pixel depends only on intensities within KERNEL_HALO pixels of it,
 * so as long as half the tile overlap is at least that wide, every pixel can be taken from a tile where it is far
 * enough from any internal tile edge, and the tiled result is identical to processing the whole image at once.
 * Only the final rescaling needs the global maximum.
 */
public abstract class GradientMaskGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(GradientMaskGenerator.class);

    /** Reach of the combined blur (2 pixels) and Sobel (1 pixel) kernels. */
    public static final int KERNEL_HALO = 3;

    /** Gaussian kernel width. A sigma of zero lets OpenCV derive it from the width. */
    private static final int GAUSSIAN_SIZE = 5;

    private static final int SOBEL_SIZE = 3;

    private static final int BORDER = opencv_core.BORDER_REFLECT_101;

    public static final double MAX_MAGNITUDE = 255;

    /** Generate a roof mask from the whole image in one pass. */
    public static BooleanMask generate (RasterGrid image, double threshold) {
        return generate(image, threshold, null);
    }

    /**
     * Generate a roof mask, computing gradients tile by tile when tiles are supplied and their overlap is wide enough
     * for the tiled result to match the untiled one. The thresholding itself is always global.
     *
     * @param threshold fraction of the maximum gradient magnitude, clipped to [0, 1].
     * @param tiles may be null to process the whole image at once.
     */
    public static BooleanMask generate (RasterGrid image, double threshold, TileWindower tiles) {
        double[] magnitude = normalizedMagnitude(image, tiles);
        return threshold(magnitude, image.width, image.height, threshold);
    }

    /**
     * Gradient magnitude of the image intensity, rescaled so that its maximum is 255. A flat image has no gradient
     * and is left at zero everywhere.
     */
    public static double[] normalizedMagnitude (RasterGrid image, TileWindower tiles) {
        double[] intensity = intensity(image);
        double[] magnitude;
        if (tiles != null && supportsTiling(tiles)) {
            checkArgument(tiles.gridWidth == image.width && tiles.gridHeight == image.height,
                    "Tiles do not match image dimensions.");
            magnitude = gradientMagnitude(intensity, image.width, image.height, tiles);
        } else {
            if (tiles != null) {
                LOG.debug("Tile overlap {} is too small for seamless tiling, processing the image as a single tile.",
                        tiles.overlap);
            }
            magnitude = gradientMagnitude(intensity, image.width, image.height);
        }
        normalize(magnitude);
        return magnitude;
    }

    /** True if the tiles overlap enough that tiled gradients are identical to untiled ones. */
    public static boolean supportsTiling (TileWindower tiles) {
        return tiles.overlap / 2 >= KERNEL_HALO;
    }

    /**
     * Reduce an image to one intensity band. Single band images are used as they are, otherwise the first three bands
     * (red, green, blue) are averaged with equal weights.
     */
    public static double[] intensity (RasterGrid image) {
        if (image.bandCount() == 1) {
            return image.band(0).clone();
        }
        int nBands = Math.min(3, image.bandCount());
        double[] intensity = new double[image.width * image.height];
        for (int b = 0; b < nBands; b++) {
            double[] band = image.band(b);
            for (int i = 0; i < intensity.length; i++) {
                intensity[i] += band[i];
            }
        }
        for (int i = 0; i < intensity.length; i++) {
            intensity[i] /= nBands;
        }
        return intensity;
    }

    /** Unnormalized gradient magnitude of a single band, processed as one tile. */
    public static double[] gradientMagnitude (double[] intensity, int width, int height) {
        checkArgument(intensity.length == width * height, "Band length does not match dimensions.");
        int depth = opencv_core.CV_64F;
        try (Mat mat = new Mat(height, width, opencv_core.CV_64FC1);
             Mat blurred = new Mat();
             Mat gx = new Mat();
             Mat gy = new Mat();
             Mat magnitude = new Mat();
             Size size = new Size(GAUSSIAN_SIZE, GAUSSIAN_SIZE)) {
            DoubleIndexer idxInput = mat.createIndexer();
            idxInput.put(0L, intensity);
            idxInput.release();
            opencv_imgproc.GaussianBlur(mat, blurred, size, 0, 0, BORDER);
            opencv_imgproc.Sobel(blurred, gx, depth, 1, 0, SOBEL_SIZE, 1, 0, BORDER);
            opencv_imgproc.Sobel(blurred, gy, depth, 0, 1, SOBEL_SIZE, 1, 0, BORDER);
            opencv_core.magnitude(gx, gy, magnitude);
            double[] pixels = new double[width * height];
            DoubleIndexer idxOutput = magnitude.createIndexer();
            idxOutput.get(0L, pixels);
            idxOutput.release();
            return pixels;
        }
    }

    /**
     * Unnormalized gradient magnitude computed independently for each tile, in parallel. Each tile contributes only
     * its core: the part that lies at least half the overlap away from its internal edges, up to where the core of the
     * next tile begins. Cores partition the grid, so tiles never write the same output pixel.
     */
    public static double[] gradientMagnitude (double[] intensity, int width, int height, TileWindower tiles) {
        double[] magnitude = new double[width * height];
        int halfOverlap = tiles.overlap / 2;
        tiles.stream().parallel().forEach(window -> {
            double[] tile = extract(intensity, width, window);
            double[] tileMagnitude = gradientMagnitude(tile, window.width, window.height);
            int colStart = window.colOff == 0 ? 0 : window.colOff + halfOverlap;
            int rowStart = window.rowOff == 0 ? 0 : window.rowOff + halfOverlap;
            int colEnd = Math.min(width, window.colOff + tiles.strideX() + halfOverlap);
            int rowEnd = Math.min(height, window.rowOff + tiles.strideY() + halfOverlap);
            for (int row = rowStart; row < rowEnd; row++) {
                for (int col = colStart; col < colEnd; col++) {
                    magnitude[row * width + col] =
                            tileMagnitude[(row - window.rowOff) * window.width + (col - window.colOff)];
                }
            }
        });
        return magnitude;
    }

    private static double[] extract (double[] band, int width, Window window) {
        double[] tile = new double[window.pixelCount()];
        for (int row = 0; row < window.height; row++) {
            System.arraycopy(band, (window.rowOff + row) * width + window.colOff, tile, row * window.width, window.width);
        }
        return tile;
    }

    /** Rescale in place so the maximum becomes MAX_MAGNITUDE. Left unchanged if the maximum is not positive. */
    static void normalize (double[] magnitude) {
        double max = 0;
        for (double m : magnitude) {
            if (m > max) max = m;
        }
        if (max > 0) {
            for (int i = 0; i < magnitude.length; i++) {
                magnitude[i] = magnitude[i] / max * MAX_MAGNITUDE;
            }
        }
    }

    /** Pixels whose normalized magnitude is strictly greater than the threshold (clipped to [0, 1]) times 255. */
    public static BooleanMask threshold (double[] normalizedMagnitude, int width, int height, double threshold) {
        checkArgument(!Double.isNaN(threshold), "Threshold must be a number.");
        double cutoff = Math.max(0, Math.min(1, threshold)) * MAX_MAGNITUDE;
        BooleanMask mask = new BooleanMask(width, height);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                if (normalizedMagnitude[row * width + col] > cutoff) {
                    mask.set(col, row, true);
                }
            }
        }
        return mask;
    }

}
