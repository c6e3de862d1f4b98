package com.github.salilvnair.commandconsole.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final Pattern JSON_OBJECT_PATTERN = Pattern.compile("\\{.*}", Pattern.DOTALL);

    private static final TypeReference<List<Map<String, Object>>> ROWS_TYPE = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** Parse JSON string safely (used for inference output, stored payloads, etc.) */
    public static JsonNode parseOrNull(String json) {
        if (json == null || json.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return MAPPER.readTree(json);
        } catch (Exception e) {
            return NullNode.getInstance();
        }
    }

    /**
     * Models tend to wrap JSON in prose or code fences; pull out the outermost object.
     */
    public static JsonNode extractObject(String text) {
        if (text == null || text.isBlank()) {
            return NullNode.getInstance();
        }
        JsonNode direct = parseOrNull(text.trim());
        if (direct.isObject()) {
            return direct;
        }
        Matcher matcher = JSON_OBJECT_PATTERN.matcher(text);
        if (!matcher.find()) {
            return NullNode.getInstance();
        }
        return parseOrNull(matcher.group());
    }

    /**
     * Convert any object into JSON string.
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize object to JSON", e);
        }
    }

    /**
     * Parse JSON string into target type.
     */
    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to deserialize JSON", e);
        }
    }

    public static <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to deserialize JSON", e);
        }
    }

    public static List<Map<String, Object>> toRows(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        return fromJson(json, ROWS_TYPE);
    }

    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        return fromJson(json, MAP_TYPE);
    }

    public static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return MAPPER.convertValue(node, Object.class);
    }
}
