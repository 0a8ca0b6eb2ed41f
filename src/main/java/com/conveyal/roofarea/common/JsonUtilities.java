package com.conveyal.roofarea.common;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * A library containing static methods for working with JSON.
 */
public abstract class JsonUtilities {

    /**
     * Vector inputs are often hand-edited, so comments are tolerated. Unknown members are expected in GeoJSON
     * (foreign members are explicitly allowed) and are ignored.
     */
    public static final ObjectMapper objectMapper = createBaseObjectMapper();

    private static ObjectMapper createBaseObjectMapper () {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return objectMapper;
    }

}
