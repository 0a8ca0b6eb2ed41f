package com.conveyal.roofarea.vector;

import com.conveyal.roofarea.RasterFixtures;
import com.conveyal.roofarea.common.Crs;
import com.conveyal.roofarea.common.DataSourceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.MultiPolygon;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GeoJsonFeatureReaderTest {

    @TempDir
    Path tempDir;

    @Test
    public void featureCollectionWithNamedCrs () throws Exception {
        FeatureCollection roofs = GeoJsonFeatureReader.read(RasterFixtures.resource("roofs-buildings.geojson"));
        assertEquals(Crs.of("EPSG:3857"), roofs.crs);
        assertEquals(4, roofs.size());
        assertTrue(roofs.hasColumn("building_id"));
        assertTrue(roofs.hasValues("tile_id"));
        assertEquals(2, roofs.features().get(0).get("building_id"));
        assertNull(roofs.features().get(3).get("building_id"));
        assertTrue(roofs.features().get(2).geometry instanceof MultiPolygon);
        assertEquals(100, roofs.features().get(0).geometry.getArea(), 1e-9);
    }

    @Test
    public void featureIds () throws Exception {
        FeatureCollection truth = GeoJsonFeatureReader.read(RasterFixtures.resource("ground-truth-3857.geojson"));
        assertEquals("roof-a", truth.features().get(0).id);
        FeatureCollection numbered = GeoJsonFeatureReader.parse(
                "{\"type\": \"Feature\", \"id\": 12, \"properties\": null, \"geometry\": null}");
        assertEquals(12, numbered.features().get(0).id);
        assertFalse(numbered.features().get(0).hasGeometry());
        assertTrue(numbered.features().get(0).properties.isEmpty());
    }

    @Test
    public void crsDefaults () throws Exception {
        assertEquals(Crs.of(Crs.WGS84), GeoJsonFeatureReader.read(RasterFixtures.resource("roofs-wgs84.geojson")).crs);
        assertNull(GeoJsonFeatureReader.read(RasterFixtures.resource("footprints-no-crs.geojson")).crs);
        FeatureCollection legacy = GeoJsonFeatureReader.parse("{\"type\": \"FeatureCollection\", "
                + "\"crs\": {\"type\": \"EPSG\", \"properties\": {\"code\": 32633}}, \"features\": []}");
        assertEquals(Crs.of("EPSG:32633"), legacy.crs);
        assertTrue(legacy.isEmpty());
    }

    @Test
    public void bareGeometry () {
        FeatureCollection single = GeoJsonFeatureReader.parse(
                "{\"type\": \"Polygon\", \"coordinates\": [[[0, 0], [2, 0], [2, 2], [0, 2], [0, 0]]]}");
        assertEquals(1, single.size());
        assertEquals(4, single.features().get(0).geometry.getArea(), 1e-12);
        assertTrue(single.columns().isEmpty());
    }

    @Test
    public void invalidInput () {
        assertThrows(DataSourceException.class, () -> GeoJsonFeatureReader.parse("{ not json"));
        assertThrows(DataSourceException.class, () -> GeoJsonFeatureReader.parse("[1, 2, 3]"));
        assertThrows(DataSourceException.class, () -> GeoJsonFeatureReader.parse(
                "{\"type\": \"FeatureCollection\", \"features\": [{\"type\": \"Point\"}]}"));
        assertThrows(DataSourceException.class, () -> GeoJsonFeatureReader.parse(
                "{\"type\": \"FeatureCollection\", \"crs\": {\"type\": \"name\", "
                        + "\"properties\": {\"name\": \"EPSG:999999\"}}, \"features\": []}"));
        assertThrows(NoSuchFileException.class, () -> GeoJsonFeatureReader.read(tempDir.resolve("absent.geojson")));
    }

}
