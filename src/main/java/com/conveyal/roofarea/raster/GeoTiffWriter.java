package com.conveyal.roofarea.raster;

import com.conveyal.roofarea.common.DataSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

import static com.conveyal.roofarea.raster.GeoTiffReader.GEOGRAPHIC_TYPE_KEY;
import static com.conveyal.roofarea.raster.GeoTiffReader.GT_MODEL_TYPE_KEY;
import static com.conveyal.roofarea.raster.GeoTiffReader.GT_RASTER_TYPE_KEY;
import static com.conveyal.roofarea.raster.GeoTiffReader.MODEL_TYPE_GEOGRAPHIC;
import static com.conveyal.roofarea.raster.GeoTiffReader.MODEL_TYPE_PROJECTED;
import static com.conveyal.roofarea.raster.GeoTiffReader.PROJECTED_CS_TYPE_KEY;
import static com.conveyal.roofarea.raster.GeoTiffReader.RASTER_PIXEL_IS_AREA;
import static com.google.common.base.Preconditions.checkArgument;

/**
 * Writes byte-valued GeoTIFFs with LZW compression through the JDK TIFF plugin, with the georeferencing tags that
 * GeoTiffReader (and GDAL-based tools) understand. The main use is writing roof masks as single band 0/1 images.
 */
public abstract class GeoTiffWriter {

    private static final Logger LOG = LoggerFactory.getLogger(GeoTiffWriter.class);

    /** Write a mask as a single band byte GeoTIFF with values 0 and 1, aligned with the given grid. */
    public static void writeMask (BooleanMask mask, GridGeometry geometry, Path file) throws IOException {
        checkArgument(mask.sameShape(geometry), "Mask is %sx%s but grid is %sx%s.",
                mask.width, mask.height, geometry.width, geometry.height);
        BufferedImage image = new BufferedImage(mask.width, mask.height, BufferedImage.TYPE_BYTE_GRAY);
        byte[] imagePixels = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        byte[] maskPixels = mask.toBytes();
        System.arraycopy(maskPixels, 0, imagePixels, 0, maskPixels.length);
        write(image, geometry, file);
        LOG.debug("Wrote {} mask with {} true pixels to {}.", geometry, mask.count(), file);
    }

    /**
     * Write a one or three band raster as bytes. Samples are rounded and clamped to 0...255. Three band rasters are
     * written as RGB in band order.
     */
    public static void write (RasterGrid raster, Path file) throws IOException {
        int imageType;
        if (raster.bandCount() == 1) {
            imageType = BufferedImage.TYPE_BYTE_GRAY;
        } else if (raster.bandCount() == 3) {
            imageType = BufferedImage.TYPE_3BYTE_BGR;
        } else {
            throw new IllegalArgumentException("Only one or three band rasters can be written, got " + raster.bandCount());
        }
        BufferedImage image = new BufferedImage(raster.width, raster.height, imageType);
        WritableRaster pixels = image.getRaster();
        for (int b = 0; b < raster.bandCount(); b++) {
            double[] samples = raster.band(b);
            for (int row = 0; row < raster.height; row++) {
                for (int col = 0; col < raster.width; col++) {
                    long value = Math.round(samples[row * raster.width + col]);
                    pixels.setSample(col, row, b, (int) Math.max(0, Math.min(255, value)));
                }
            }
        }
        write(image, raster.geometry, file);
    }

    private static void write (BufferedImage image, GridGeometry geometry, Path file) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("tiff");
        if (!writers.hasNext()) {
            throw new IllegalStateException("No TIFF image writer is available.");
        }
        ImageWriter writer = writers.next();
        try {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionType("LZW");
            IIOMetadata defaultMetadata =
                    writer.getDefaultImageMetadata(ImageTypeSpecifier.createFromRenderedImage(image), param);
            TIFFDirectory directory = TIFFDirectory.createFromMetadata(defaultMetadata);
            // Must run before the output file is opened and truncated.
            addGeoreferencing(directory, geometry);
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            // Files.newOutputStream truncates any existing file, which ImageIO's own file streams do not do.
            try (OutputStream out = Files.newOutputStream(file);
                 ImageOutputStream imageOut = ImageIO.createImageOutputStream(out)) {
                writer.setOutput(imageOut);
                writer.write(null, new IIOImage(image, null, directory.getAsMetadata()), param);
            }
        } finally {
            writer.dispose();
        }
    }

    private static void addGeoreferencing (TIFFDirectory directory, GridGeometry geometry) {
        GeoTIFFTagSet geoTags = GeoTIFFTagSet.getInstance();
        double[] m = geometry.pixelToWorld().getMatrixEntries();
        if (m[1] == 0 && m[3] == 0 && m[0] > 0 && m[4] < 0) {
            // North-up grid: the common pixel scale plus a single tie point at the top left corner.
            directory.addTIFFField(new TIFFField(geoTags.getTag(GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE),
                    TIFFTag.TIFF_DOUBLE, 3, new double[] { m[0], -m[4], 0 }));
            directory.addTIFFField(new TIFFField(geoTags.getTag(GeoTIFFTagSet.TAG_MODEL_TIE_POINT),
                    TIFFTag.TIFF_DOUBLE, 6, new double[] { 0, 0, 0, m[2], m[5], 0 }));
        } else {
            double[] matrix = {
                    m[0], m[1], 0, m[2],
                    m[3], m[4], 0, m[5],
                    0, 0, 0, 0,
                    0, 0, 0, 1
            };
            directory.addTIFFField(new TIFFField(geoTags.getTag(GeoTIFFTagSet.TAG_MODEL_TRANSFORMATION),
                    TIFFTag.TIFF_DOUBLE, 16, matrix));
        }
        if (geometry.crs == null) {
            LOG.warn("Writing GeoTIFF without a CRS.");
            return;
        }
        int code = geometry.crs.epsgCode();
        if (code <= 0 || code > 0xFFFF) {
            throw new DataSourceException("Only CRSs with an EPSG code can be written to GeoTIFF, got " + geometry.crs);
        }
        boolean geographic = geometry.crs.isGeographic();
        char[] keys = {
                1, 1, 0, 3,
                GT_MODEL_TYPE_KEY, 0, 1, (char) (geographic ? MODEL_TYPE_GEOGRAPHIC : MODEL_TYPE_PROJECTED),
                GT_RASTER_TYPE_KEY, 0, 1, RASTER_PIXEL_IS_AREA,
                (char) (geographic ? GEOGRAPHIC_TYPE_KEY : PROJECTED_CS_TYPE_KEY), 0, 1, (char) code
        };
        directory.addTIFFField(new TIFFField(geoTags.getTag(GeoTIFFTagSet.TAG_GEO_KEY_DIRECTORY),
                TIFFTag.TIFF_SHORT, keys.length, keys));
    }

}
