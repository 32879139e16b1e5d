package com.jsonvaluate.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.Map;

/**
 * Factory for data records parsed from JSON payloads.
 * Nested objects stay nested maps and arrays stay lists; keys are not flattened.
 */
public final class DataRecords {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private DataRecords() {
    }

    /**
     * Parse a JSON object into a data record.
     *
     * @param jsonPayload JSON object text; null or blank yields an empty record
     * @return unmodifiable data record
     * @throws IllegalArgumentException if the payload is not a valid JSON object
     */
    public static Map<String, Object> fromJson(String jsonPayload) {
        if (jsonPayload == null || jsonPayload.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(jsonPayload, new TypeReference<Map<String, Object>>() {});
            return parsed == null ? Map.of() : Collections.unmodifiableMap(parsed);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getMessage(), e);
        }
    }
}
