package com.conveyal.roofarea.pipeline;

import com.conveyal.roofarea.RasterFixtures;
import com.conveyal.roofarea.RoofAreaException;
import com.conveyal.roofarea.mask.FootprintConstrainer;
import com.conveyal.roofarea.raster.GeoTiffReader;
import com.conveyal.roofarea.raster.RasterGrid;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RoofMaskInferenceTest {

    private static final Logger LOG = LoggerFactory.getLogger(RoofMaskInferenceTest.class);

    @TempDir
    Path tempDir;

    /** Footprints cover the left half of the image, so no roof pixel can appear in the right half. */
    @Test
    public void baselineWritesFootprintConstrainedMask () throws Exception {
        Path raster = RasterFixtures.writeBrightSquare(tempDir);
        InferenceRequest request = new InferenceRequest(raster, RasterFixtures.resource("footprints-3857.geojson"));
        request.outputPath = tempDir.resolve("mask.tif");
        request.threshold = 0;

        InferenceResult result = RoofMaskInference.run(request, LOG);
        assertEquals(request.outputPath, result.outputPath);
        assertEquals(InferenceMode.HEURISTIC_BASELINE, result.mode);

        RasterGrid mask = GeoTiffReader.read(request.outputPath);
        assertEquals(10, mask.width);
        assertEquals(10, mask.height);
        int roofPixels = 0;
        for (int row = 0; row < 10; row++) {
            for (int col = 0; col < 10; col++) {
                double value = mask.get(0, col, row);
                assertTrue(value == 0 || value == 1);
                if (col >= 5) assertEquals(0, value, 0);
                if (value == 1) roofPixels += 1;
            }
        }
        assertTrue(roofPixels > 0);
        assertEquals(roofPixels, result.roofPixels);
        assertEquals(roofPixels, result.roofAreaM2, 1e-9);
        assertTrue(result.edgeConfidence > 0 && result.edgeConfidence <= 1);
        assertTrue(result.shadowScore >= 0 && result.shadowScore <= 1);
        assertEquals(RasterFixtures.brightSquare().geometry, mask.geometry);
    }

    @Test
    public void defaultOutputNextToRaster () throws Exception {
        Path raster = RasterFixtures.writeBrightSquare(tempDir);
        InferenceRequest request = new InferenceRequest(raster, RasterFixtures.resource("footprints-3857.geojson"));
        InferenceResult result = RoofMaskInference.run(request, LOG);
        assertEquals(tempDir.resolve("image_roof_mask.tif"), result.outputPath);
        assertTrue(Files.exists(result.outputPath));
    }

    @Test
    public void areaOfInterestCropsRaster () throws Exception {
        Path raster = RasterFixtures.writeBrightSquare(tempDir);
        InferenceRequest request = new InferenceRequest(raster, RasterFixtures.resource("footprints-3857.geojson"));
        request.outputPath = tempDir.resolve("aoi.tif");
        request.areaOfInterest = AreaOfInterest.parse("0,0,5,5", "EPSG:3857");
        RoofMaskInference.run(request, LOG);
        RasterGrid mask = GeoTiffReader.read(request.outputPath);
        assertEquals(5, mask.width);
        assertEquals(5, mask.height);
        assertEquals(0, mask.geometry.bounds().getMinY(), 1e-9);
    }

    @Test
    public void baselineRequiresFootprints () throws Exception {
        Path raster = RasterFixtures.writeBrightSquare(tempDir);
        RoofAreaException e = assertThrows(RoofAreaException.class,
                () -> RoofMaskInference.run(new InferenceRequest(raster, null), LOG));
        assertEquals(RoofAreaException.Type.PRECONDITION, e.type);
        assertEquals(FootprintConstrainer.NO_FOOTPRINTS_MESSAGE, e.getMessage());
    }

    @Test
    public void emptyFootprintsLeaveNoOutput () throws Exception {
        Path raster = RasterFixtures.writeBrightSquare(tempDir);
        InferenceRequest request = new InferenceRequest(raster, RasterFixtures.resource("footprints-empty.geojson"));
        request.outputPath = tempDir.resolve("never.tif");
        RoofAreaException e = assertThrows(RoofAreaException.class, () -> RoofMaskInference.run(request, LOG));
        assertEquals(RoofAreaException.Type.PRECONDITION, e.type);
        assertFalse(Files.exists(request.outputPath));
    }

    /** The learned model mode is rejected before the raster is even opened. */
    @Test
    public void learnedModelIsNotImplemented () {
        InferenceRequest request = new InferenceRequest(tempDir.resolve("absent.tif"), null);
        request.modelPath = tempDir.resolve("model.pt");
        assertEquals(InferenceMode.LEARNED_MODEL, request.mode());
        RoofAreaException e = assertThrows(RoofAreaException.class, () -> RoofMaskInference.run(request, LOG));
        assertEquals(RoofAreaException.Type.UNSUPPORTED, e.type);
        assertEquals(RoofMaskInference.MODEL_NOT_IMPLEMENTED_MESSAGE, e.getMessage());
    }

}
