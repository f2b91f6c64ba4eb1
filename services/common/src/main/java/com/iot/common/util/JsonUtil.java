package com.iot.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

/**
 * Shared Jackson setup for diagnostics payloads.
 * Both the HTTP and the command-line adapter serialize through this mapper
 * so the two produce identical JSON.
 */
public final class JsonUtil {

    private static final ObjectMapper OBJECT_MAPPER = createObjectMapper();

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private JsonUtil() {} // Prevent instantiation

    public static ObjectMapper getObjectMapper() {
        return OBJECT_MAPPER;
    }

    /**
     * Creates a new configured ObjectMapper instance.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Diagnosis timestamps as ISO-8601 strings
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // Records may carry extra sensor fields we do not model
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

        // Trailing garbage after the batch array is a malformed payload
        mapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

        return mapper;
    }

    /**
     * Parses a payload into a tree. Parse failures are left to the caller,
     * which reports them separately from processing errors.
     */
    public static JsonNode readTree(String json) throws JsonProcessingException {
        return OBJECT_MAPPER.readTree(json);
    }

    /**
     * Converts one JSON object into raw record values (numbers, strings, booleans, nulls, nested structures).
     */
    public static Map<String, Object> toRecordValues(JsonNode node) {
        return OBJECT_MAPPER.convertValue(node, RECORD_TYPE);
    }

    public static String toJson(Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }
}
