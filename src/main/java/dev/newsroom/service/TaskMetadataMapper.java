package dev.newsroom.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and merges the free-form JSON metadata stored on tasks.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskMetadataMapper {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable task metadata: {}", e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    /**
     * Returns the existing metadata with the additions applied. Null values in the
     * additions are skipped.
     */
    public String merge(String existingJson, Map<String, ?> additions) {
        Map<String, Object> merged = read(existingJson);
        if (additions != null) {
            additions.forEach((key, value) -> {
                if (value != null) {
                    merged.put(key, value);
                }
            });
        }
        try {
            return objectMapper.writeValueAsString(merged);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task metadata", e);
        }
    }
}
