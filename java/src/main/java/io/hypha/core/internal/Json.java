package io.hypha.core.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Centralised ObjectMapper configuration.
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("value is not JSON serialisable: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Parses values that look like a JSON object or array, returning anything else untouched.
     */
    public static Object parseIfStructured(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        boolean structured = (trimmed.startsWith("{") && trimmed.endsWith("}"))
            || (trimmed.startsWith("[") && trimmed.endsWith("]"));
        if (!structured) {
            return value;
        }
        try {
            return MAPPER.readValue(trimmed, Object.class);
        } catch (JsonProcessingException ex) {
            return value;
        }
    }
}
