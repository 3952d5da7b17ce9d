package de.bsommerfeld.forum.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.forum.core.error.StoreException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson bridge for the JSON columns and parameters of {@link SqlRecordStore}:
 * the {@code flags} object of a message and the id arrays fed to
 * {@code json_each(?)}.
 */
final class JsonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, String>> FLAGS_TYPE = new TypeReference<>() {
    };

    private JsonCodec() {
    }

    static String writeFlags(Map<String, String> flags) {
        return write(flags == null ? Map.of() : flags);
    }

    static Map<String, String> readFlags(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, FLAGS_TYPE);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt flags column: " + json, e);
        }
    }

    static String writeIds(Collection<Long> ids) {
        return write(ids);
    }

    /**
     * JSON path addressing one top-level key, quoted so keys like
     * {@code no-answer} survive SQLite's path syntax.
     */
    static String flagPath(String key) {
        return "$.\"" + key + "\"";
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize " + value, e);
        }
    }
}
