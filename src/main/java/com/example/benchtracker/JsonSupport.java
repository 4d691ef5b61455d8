package com.example.benchtracker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shared Jackson setup for the state and report files: snake_case keys and ISO-8601 instants.
 */
public final class JsonSupport {
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private JsonSupport() {
    }

    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /**
     * Converts an arbitrary string-keyed map into exactly the values a JSON reload would produce,
     * so an in-memory map and its persisted form compare equal.
     */
    public static Map<String, Object> normalize(ObjectMapper mapper, Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return new LinkedHashMap<>();
        }
        try {
            return mapper.readValue(mapper.writeValueAsBytes(values), MAP_TYPE);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Value is not representable as JSON: " + ex.getMessage(), ex);
        }
    }
}
