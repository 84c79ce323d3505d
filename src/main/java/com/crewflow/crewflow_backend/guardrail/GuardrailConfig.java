package com.crewflow.crewflow_backend.guardrail;

import com.crewflow.crewflow_backend.exception.ConfigException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed guardrail rule: the {@code type} plus every other key of the rule map.
 * Tasks store the rule either as a map or as its JSON string form.
 */
public record GuardrailConfig(String type, Map<String, Object> values) {

    @SuppressWarnings("unchecked")
    public static GuardrailConfig parse(Object raw, ObjectMapper mapper) {
        Map<String, Object> map;
        if (raw instanceof Map<?, ?> m) {
            map = new LinkedHashMap<>((Map<String, Object>) m);
        } else if (raw instanceof String s && !s.isBlank()) {
            try {
                map = mapper.readValue(s, new TypeReference<LinkedHashMap<String, Object>>() {});
            } catch (JsonProcessingException e) {
                throw new ConfigException("Guardrail config is not valid JSON: " + e.getOriginalMessage());
            }
        } else {
            throw new ConfigException("Guardrail config must be a map or a JSON object string");
        }
        Object type = map.get("type");
        if (!(type instanceof String t) || t.isBlank()) {
            throw new ConfigException("Guardrail config has no type");
        }
        return new GuardrailConfig(t.trim(), map);
    }

    public double number(String key, double fallback) {
        Object value = values.get(key);
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ConfigException("Guardrail setting " + key + " is not a number: " + s);
            }
        }
        return fallback;
    }

    public long integer(String key, long fallback) {
        return (long) number(key, fallback);
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public String string(String key, String fallback) {
        Object value = values.get(key);
        return value != null ? String.valueOf(value) : fallback;
    }
}
