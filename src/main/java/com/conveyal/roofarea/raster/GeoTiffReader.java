package com.conveyal.roofarea.raster;

import com.conveyal.roofarea.common.Crs;
import com.conveyal.roofarea.common.DataSourceException;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.plugins.tiff.GeoTIFFTagSet;
import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.Raster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Reads GeoTIFF files into RasterGrids using the TIFF plugin built into the JDK. Only the georeferencing that the
 * roof area tools need is interpreted: the affine transform (from ModelPixelScale and ModelTiepoint, or from
 * ModelTransformation) and the CRS as an EPSG code in the GeoKey directory. All bands are read, whatever their
 * sample type, and converted to doubles.
 */
public abstract class GeoTiffReader {

    private static final Logger LOG = LoggerFactory.getLogger(GeoTiffReader.class);

    /** Name of the native metadata format of the JDK TIFF plugin. */
    static final String TIFF_METADATA_FORMAT = "javax_imageio_tiff_image_1.0";

    // GeoKey IDs and values, from the GeoTIFF 1.0 specification.
    static final int GT_MODEL_TYPE_KEY = 1024;
    static final int GT_RASTER_TYPE_KEY = 1025;
    static final int GEOGRAPHIC_TYPE_KEY = 2048;
    static final int PROJECTED_CS_TYPE_KEY = 3072;
    static final int MODEL_TYPE_PROJECTED = 1;
    static final int MODEL_TYPE_GEOGRAPHIC = 2;
    static final int RASTER_PIXEL_IS_AREA = 1;
    static final int RASTER_PIXEL_IS_POINT = 2;

    public static RasterGrid read (Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(file.toFile())) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                throw new DataSourceException("Unrecognized raster format: " + file);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, false);
                IIOMetadata metadata = reader.getImageMetadata(0);
                if (metadata == null || !TIFF_METADATA_FORMAT.equals(metadata.getNativeMetadataFormatName())) {
                    throw new DataSourceException("Only GeoTIFF rasters are supported, could not read " + file);
                }
                Raster raster = reader.read(0).getRaster();
                int width = raster.getWidth();
                int height = raster.getHeight();
                GridGeometry geometry = gridGeometry(TIFFDirectory.createFromMetadata(metadata), width, height, file);
                double[][] bands = new double[raster.getNumBands()][];
                for (int b = 0; b < bands.length; b++) {
                    bands[b] = raster.getSamples(raster.getMinX(), raster.getMinY(), width, height, b, (double[]) null);
                }
                LOG.debug("Read {} band raster {} ({}x{}, CRS {}).", bands.length, file, width, height, geometry.crs);
                return new RasterGrid(geometry, bands);
            } catch (UnsupportedOperationException | IllegalStateException e) {
                // The TIFF plugin reports some layouts it cannot decode with unchecked exceptions.
                throw new DataSourceException("Could not decode raster " + file + ": " + e.getMessage(), e);
            } finally {
                reader.dispose();
            }
        }
    }

    private static GridGeometry gridGeometry (TIFFDirectory directory, int width, int height, Path file) {
        TIFFField transformField = directory.getTIFFField(GeoTIFFTagSet.TAG_MODEL_TRANSFORMATION);
        TIFFField scaleField = directory.getTIFFField(GeoTIFFTagSet.TAG_MODEL_PIXEL_SCALE);
        TIFFField tiePointField = directory.getTIFFField(GeoTIFFTagSet.TAG_MODEL_TIE_POINT);
        AffineTransformation transform;
        if (transformField != null && transformField.getCount() >= 8) {
            // Row-major 4x4 matrix, of which only the 2D affine part is used.
            double[] m = doubles(transformField);
            transform = new AffineTransformation(m[0], m[1], m[3], m[4], m[5], m[7]);
        } else if (scaleField != null && tiePointField != null && tiePointField.getCount() >= 6) {
            double[] scale = doubles(scaleField);
            double[] tiePoint = doubles(tiePointField);
            // Tie point maps raster (I, J) to model (X, Y). Raster rows increase southward, so the y scale is negated.
            double i = tiePoint[0], j = tiePoint[1], x = tiePoint[3], y = tiePoint[4];
            transform = new AffineTransformation(scale[0], 0, x - i * scale[0], 0, -scale[1], y + j * scale[1]);
        } else {
            throw new DataSourceException("Raster " + file + " is not georeferenced: it has neither ModelTransformation "
                    + "nor ModelPixelScale and ModelTiepoint tags.");
        }
        GeoKeys keys = GeoKeys.parse(directory.getTIFFField(GeoTIFFTagSet.TAG_GEO_KEY_DIRECTORY));
        if (keys.rasterType == RASTER_PIXEL_IS_POINT) {
            // Model coordinates refer to pixel centers. Shift by half a pixel so the transform refers to corners.
            transform = AffineTransformation.translationInstance(-0.5, -0.5).compose(transform);
        }
        Crs crs = keys.crs();
        if (crs == null) {
            LOG.warn("Raster {} does not declare an EPSG-coded CRS.", file);
        }
        return new GridGeometry(width, height, transform, crs);
    }

    private static double[] doubles (TIFFField field) {
        double[] values = new double[field.getCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = field.getAsDouble(i);
        }
        return values;
    }

    /** The few GeoKeys that determine how the transform is interpreted and which CRS it refers to. */
    static class GeoKeys {

        int modelType;
        int rasterType = RASTER_PIXEL_IS_AREA;
        int projectedCode;
        int geographicCode;

        /**
         * The GeoKey directory is a flat array of shorts: a header (version, revision, minor revision, key count)
         * followed by four shorts per key (key id, location, count, value). A location of zero means the value is
         * stored inline; keys stored in other tags are not needed here.
         */
        static GeoKeys parse (TIFFField field) {
            GeoKeys keys = new GeoKeys();
            if (field == null || field.getCount() < 4) return keys;
            int nKeys = field.getAsInt(3);
            for (int k = 0, offset = 4; k < nKeys && offset + 3 < field.getCount(); k++, offset += 4) {
                if (field.getAsInt(offset + 1) != 0) continue;
                int value = field.getAsInt(offset + 3);
                switch (field.getAsInt(offset)) {
                    case GT_MODEL_TYPE_KEY: keys.modelType = value; break;
                    case GT_RASTER_TYPE_KEY: keys.rasterType = value; break;
                    case PROJECTED_CS_TYPE_KEY: keys.projectedCode = value; break;
                    case GEOGRAPHIC_TYPE_KEY: keys.geographicCode = value; break;
                    default: break;
                }
            }
            return keys;
        }

        /** @return the CRS identified by an EPSG code, preferring the projected one, or null if there is none. */
        Crs crs () {
            if (isEpsgCode(projectedCode) && modelType != MODEL_TYPE_GEOGRAPHIC) {
                return Crs.fromEpsg(projectedCode);
            }
            if (isEpsgCode(geographicCode)) {
                return Crs.fromEpsg(geographicCode);
            }
            return null;
        }

        private static boolean isEpsgCode (int code) {
            return code > 0 && code != Crs.USER_DEFINED_CODE;
        }
    }

}
