package com.crewflow.crewflow_backend.guardrail;

import com.crewflow.crewflow_backend.model.guardrail.GuardrailResult;
import com.crewflow.crewflow_backend.model.guardrail.TaskOutput;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that a numeric field of the output is strictly greater than {@code min_value}.
 * <pre>{ "type": "minimum_number", "min_value": 10, "field_name": "total_count", "message": "..." }</pre>
 */
@Component
@RequiredArgsConstructor
public class MinimumNumberGuardrail implements Guardrail {

    private static final List<String> COUNT_ALIASES = List.of("total_count", "count");

    private final ObjectMapper objectMapper;

    @Override
    public String supportedType() {
        return "minimum_number";
    }

    @Override
    public GuardrailResult validate(TaskOutput output, GuardrailConfig config) {
        double minValue = config.number("min_value", 1);
        String field = config.string("field_name", "total_count");
        String min = format(minValue);
        String message = config.string("message",
                "The output should contain a '" + field + "' value greater than " + min);

        Object value = extract(output, field);
        if (value == null) {
            return GuardrailResult.reject("No " + field + " found in the output. Please include a "
                    + field + " value greater than " + min + ".");
        }

        double number;
        if (value instanceof Number n) {
            number = n.doubleValue();
        } else {
            try {
                number = Double.parseDouble(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                return GuardrailResult.reject("The " + field + " value '" + value
                        + "' is not a valid number. Please provide a numeric value greater than " + min + ".");
            }
        }
        return number > minValue ? GuardrailResult.accept() : GuardrailResult.reject(message);
    }

    // ── Value lookup ─────────────────────────────────────────────────────────

    private Object extract(TaskOutput output, String field) {
        if (output == null) return null;
        Optional<Map<String, Object>> structured = output.asStructured(objectMapper);
        if (structured.isPresent()) {
            Object found = fromMap(structured.get(), field);
            if (found != null) return found;
        }
        return fromText(output.asText(objectMapper), field);
    }

    @SuppressWarnings("unchecked")
    private Object fromMap(Map<String, Object> map, String field) {
        if (map.get(field) != null) return map.get(field);

        if (map.get("metadata") instanceof Map<?, ?> metadata && metadata.get(field) != null) {
            return metadata.get(field);
        }
        for (String alias : COUNT_ALIASES) {
            if (map.get(alias) != null) return map.get(alias);
        }
        // One level down only
        for (Object nested : map.values()) {
            if (nested instanceof Map<?, ?> inner && inner.get(field) != null) {
                return ((Map<String, Object>) inner).get(field);
            }
        }
        return null;
    }

    private Object fromText(String text, String field) {
        if (text == null || text.isBlank()) return null;
        String quoted = Pattern.quote(field);
        List<Pattern> patterns = List.of(
                Pattern.compile("[\"']" + quoted + "[\"']\\s*:\\s*[\"']?([^\"',}\\s]+)"),
                Pattern.compile("\\b" + quoted + "\\b\\s*[:=]\\s*([^\\s,;]+)", Pattern.CASE_INSENSITIVE),
                Pattern.compile("\\btotal\\s+count\\s*[:=]?\\s*(-?\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE),
                Pattern.compile("\\bcount\\s*[:=]\\s*(-?\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE));
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(text);
            if (m.find()) return m.group(1);
        }
        return null;
    }

    private static String format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
