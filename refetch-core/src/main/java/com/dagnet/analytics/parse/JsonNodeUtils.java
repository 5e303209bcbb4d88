package com.dagnet.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Shared JSON helper methods for reading optional parameter-file fields.
 */
public final class JsonNodeUtils {
    private static final Pattern INTEGER_TEXT = Pattern.compile("-?\\d{1,9}");

    private JsonNodeUtils() {}

    static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    public static String asNullableText(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        String value = node.asText();
        return value == null || value.isEmpty() ? null : value;
    }

    public static Integer asNullableInt(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            return INTEGER_TEXT.matcher(raw).matches() ? Integer.valueOf(raw) : null;
        }
        return null;
    }

    public static Double asNullableDouble(JsonNode node) {
        if (isAbsent(node) || !node.isNumber()) {
            return null;
        }
        return node.asDouble();
    }

    public static boolean asBooleanOrDefault(JsonNode node, boolean defaultValue) {
        if (isAbsent(node) || !node.isBoolean()) {
            return defaultValue;
        }
        return node.asBoolean();
    }

    /**
     * Array of text; null when the field is absent or not an array.
     */
    public static List<String> asTextList(JsonNode node) {
        if (isAbsent(node) || !node.isArray()) {
            return null;
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            values.add(asNullableText(element));
        }
        return values;
    }

    /**
     * Array of integers; individual null entries are kept so indices stay aligned with {@code dates}.
     */
    public static List<Integer> asIntList(JsonNode node) {
        if (isAbsent(node) || !node.isArray()) {
            return null;
        }
        List<Integer> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            values.add(asNullableInt(element));
        }
        return values;
    }

    public static List<Double> asDoubleList(JsonNode node) {
        if (isAbsent(node) || !node.isArray()) {
            return null;
        }
        List<Double> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            values.add(asNullableDouble(element));
        }
        return values;
    }
}
