package com.conveyal.roofarea.vector;

import com.conveyal.roofarea.RoofAreaException;
import com.conveyal.roofarea.common.Crs;
import com.conveyal.roofarea.common.DataSourceException;
import com.conveyal.roofarea.common.GeometryUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.conveyal.roofarea.common.JsonUtilities.objectMapper;

/**
 * Reads GeoJSON files into FeatureCollections. The document may be a FeatureCollection, a single Feature or a bare
 * geometry. Geometries are parsed by JTS, properties by Jackson.
 *
 * The CRS is taken from the (pre RFC 7946) "crs" member, either a named CRS such as urn:ogc:def:crs:EPSG::3857 or a
 * legacy EPSG code. When there is no crs member the RFC 7946 default of WGS84 longitude, latitude applies. An explicit
 * "crs": null yields a collection without a CRS, which downstream operations reject as a configuration problem.
 */
public class GeoJsonFeatureReader {

    private static final Logger LOG = LoggerFactory.getLogger(GeoJsonFeatureReader.class);

    private static final TypeReference<Map<String, Object>> PROPERTIES_TYPE = new TypeReference<>() { };

    private final GeoJsonReader geometryReader = new GeoJsonReader(GeometryUtils.geometryFactory);

    private final String sourceName;

    private GeoJsonFeatureReader (String sourceName) {
        this.sourceName = sourceName;
    }

    public static FeatureCollection read (Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new DataSourceException("Could not parse " + file + " as JSON.", e);
        }
        FeatureCollection features = new GeoJsonFeatureReader(file.toString()).toFeatureCollection(root);
        LOG.info("Read {} features from {} (CRS {}).", features.size(), file, features.crs);
        return features;
    }

    public static FeatureCollection parse (String json) {
        try {
            return new GeoJsonFeatureReader("GeoJSON string").toFeatureCollection(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new DataSourceException("Could not parse GeoJSON string.", e);
        }
    }

    private FeatureCollection toFeatureCollection (JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new DataSourceException(sourceName + " does not contain a GeoJSON object.");
        }
        Crs crs = crs(root);
        List<Feature> features = new ArrayList<>();
        String type = root.path("type").asText();
        switch (type) {
            case "FeatureCollection":
                JsonNode featureNodes = root.path("features");
                if (!featureNodes.isArray()) {
                    throw new DataSourceException(sourceName + " is a FeatureCollection without a features array.");
                }
                for (JsonNode featureNode : featureNodes) {
                    features.add(feature(featureNode));
                }
                break;
            case "Feature":
                features.add(feature(root));
                break;
            default:
                features.add(new Feature(geometry(root)));
                break;
        }
        return new FeatureCollection(crs, features);
    }

    private Feature feature (JsonNode featureNode) {
        if (!"Feature".equals(featureNode.path("type").asText())) {
            throw new DataSourceException(sourceName + " contains a member of a FeatureCollection that is not a Feature.");
        }
        JsonNode idNode = featureNode.get("id");
        Object id = null;
        if (idNode != null && !idNode.isNull()) {
            id = idNode.isNumber() ? idNode.numberValue() : idNode.asText();
        }
        JsonNode geometryNode = featureNode.get("geometry");
        Geometry geometry = (geometryNode == null || geometryNode.isNull()) ? null : geometry(geometryNode);
        JsonNode propertiesNode = featureNode.get("properties");
        Map<String, Object> properties = null;
        if (propertiesNode != null && propertiesNode.isObject()) {
            properties = objectMapper.convertValue(propertiesNode, PROPERTIES_TYPE);
        }
        return new Feature(id, geometry, properties);
    }

    private Geometry geometry (JsonNode geometryNode) {
        try {
            return geometryReader.read(geometryNode.toString());
        } catch (ParseException | RuntimeException e) {
            throw new DataSourceException("Invalid GeoJSON geometry in " + sourceName + ": " + e.getMessage(), e);
        }
    }

    /** @return the declared CRS, WGS84 if none is declared, or null if the crs member is explicitly null. */
    private Crs crs (JsonNode root) {
        if (!root.has("crs")) {
            return Crs.of(Crs.WGS84);
        }
        JsonNode crsNode = root.get("crs");
        if (crsNode.isNull()) {
            return null;
        }
        JsonNode properties = crsNode.path("properties");
        String crsType = crsNode.path("type").asText();
        try {
            if ("name".equalsIgnoreCase(crsType) && properties.hasNonNull("name")) {
                return Crs.of(properties.get("name").asText());
            }
            if ("EPSG".equalsIgnoreCase(crsType) && properties.hasNonNull("code")) {
                return Crs.fromEpsg(properties.get("code").asInt());
            }
        } catch (RoofAreaException e) {
            throw new DataSourceException("Unrecognized CRS in " + sourceName + ": " + crsNode, e);
        }
        throw new DataSourceException("Unsupported crs member in " + sourceName + ": " + crsNode);
    }

}
