package com.clouddeploy.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Converts map-valued fields to and from the JSON text stored in their columns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonColumnMapper {

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Serialize a map to a JSON string. Null stays null.
     */
    public String write(Map<String, ?> value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize JSON column", e);
            return null;
        }
    }

    public Map<String, Object> readObjectMap(String json) {
        return read(json, OBJECT_MAP);
    }

    public Map<String, String> readStringMap(String json) {
        return read(json, STRING_MAP);
    }

    private <T> Map<String, T> read(String json, TypeReference<Map<String, T>> type) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize JSON column", e);
            return Map.of();
        }
    }
}
