package net.chapterone.adapters.persistence;

import java.util.Map;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Serializes vectors, matrices and metadata maps for the JSONB columns.
 */
@Component
public class JsonColumnCodec {

    private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JsonColumnCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to serialize JSON column value", ex);
        }
    }

    public double[] readVector(String json) {
        return read(json, double[].class);
    }

    public double[][] readMatrix(String json) {
        return read(json, double[][].class);
    }

    public Map<String, String> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, String> metadata = objectMapper.readValue(json, METADATA_TYPE);
            return metadata == null ? Map.of() : metadata;
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to parse metadata column", ex);
        }
    }

    private <T> T read(String json, Class<T> type) {
        if (json == null) {
            throw new IllegalStateException("JSON column is null where " + type.getSimpleName() + " is required");
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to parse JSON column as " + type.getSimpleName(), ex);
        }
    }
}
