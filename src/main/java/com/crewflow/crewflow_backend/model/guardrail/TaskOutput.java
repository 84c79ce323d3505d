package com.crewflow.crewflow_backend.model.guardrail;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw output of a task attempt. Engines report plain text, a structured map, or opaque bytes;
 * every variant knows how to present itself as text and, when possible, as a map.
 */
public interface TaskOutput {

    /** Keys probed, in order, for the text body of a structured output. */
    List<String> TEXT_KEYS = List.of("content", "raw_output", "output", "text", "result", "response");

    String asText(ObjectMapper mapper);

    Optional<Map<String, Object>> asStructured(ObjectMapper mapper);

    static TaskOutput text(String value) {
        return new Text(value);
    }

    static TaskOutput structured(Map<String, Object> value) {
        return new Structured(value);
    }

    static TaskOutput opaque(byte[] value) {
        return new Opaque(value);
    }

    record Text(String value) implements TaskOutput {

        @Override
        public String asText(ObjectMapper mapper) {
            return value != null ? value : "";
        }

        @Override
        public Optional<Map<String, Object>> asStructured(ObjectMapper mapper) {
            return parseJsonObject(value, mapper);
        }
    }

    record Structured(Map<String, Object> value) implements TaskOutput {

        @Override
        public String asText(ObjectMapper mapper) {
            if (value == null || value.isEmpty()) return "";
            for (String key : TEXT_KEYS) {
                if (value.get(key) instanceof String s && !s.isBlank()) {
                    return s;
                }
            }
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }

        @Override
        public Optional<Map<String, Object>> asStructured(ObjectMapper mapper) {
            return Optional.ofNullable(value);
        }
    }

    record Opaque(byte[] value) implements TaskOutput {

        @Override
        public String asText(ObjectMapper mapper) {
            return value != null ? new String(value, StandardCharsets.UTF_8) : "";
        }

        @Override
        public Optional<Map<String, Object>> asStructured(ObjectMapper mapper) {
            return parseJsonObject(asText(mapper), mapper);
        }
    }

    private static Optional<Map<String, Object>> parseJsonObject(String raw, ObjectMapper mapper) {
        if (raw == null) return Optional.empty();
        String trimmed = raw.trim();
        if (!trimmed.startsWith("{")) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(trimmed, new TypeReference<Map<String, Object>>() {}));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
