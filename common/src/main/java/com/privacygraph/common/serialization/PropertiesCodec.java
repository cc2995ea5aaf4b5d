package com.privacygraph.common.serialization;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalizes open property maps to plain JSON values (strings, numbers, booleans, lists, nested maps).
 * A map that cannot be represented as JSON is kept as its string form under {@value #RAW_PROPERTIES_KEY}.
 */
public class PropertiesCodec {

    public static final String RAW_PROPERTIES_KEY = "raw_properties";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public PropertiesCodec() {
        this(new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    public PropertiesCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return JSON-compatible copy of the map, empty map for null, raw string fallback for unserializable input
     */
    public Map<String, Object> normalize(Map<String, ?> properties) {
        if (properties == null || properties.isEmpty()) {
            return Map.of();
        }
        try {
            JsonNode tree = objectMapper.valueToTree(properties);
            return objectMapper.convertValue(tree, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            Map<String, Object> fallback = new LinkedHashMap<>();
            fallback.put(RAW_PROPERTIES_KEY, String.valueOf(properties));
            return fallback;
        }
    }

    /**
     * Same as {@link #normalize(Map)} but keeps null as null, so "not supplied" survives partial updates.
     */
    public Map<String, Object> normalizeNullable(Map<String, ?> properties) {
        return properties == null ? null : normalize(properties);
    }
}
