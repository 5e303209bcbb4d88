package com.dagnet.analytics.parse;

import com.dagnet.analytics.model.LatencyConfig;
import com.dagnet.analytics.model.ParameterValue;
import com.dagnet.analytics.util.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes parameter-file slices using the on-disk field names.
 *
 * <p>Absent fields stay absent on write, so reading and re-writing a slice is stable.</p>
 */
public final class ParameterValueJson {
    static final String VALUES = "values";

    private ParameterValueJson() {}

    /**
     * Accepts a bare array of slices or a parameter-file object with a {@code values} array.
     */
    public static List<ParameterValue> readValues(String json) {
        return readValues(JsonSupport.readTree(json));
    }

    public static List<ParameterValue> readValues(JsonNode root) {
        JsonNode array = root != null && root.isObject() ? root.path(VALUES) : root;
        List<ParameterValue> values = new ArrayList<>();
        if (JsonNodeUtils.isAbsent(array)) {
            return values;
        }
        if (!array.isArray()) {
            throw new IllegalArgumentException("Expected an array of parameter values but found " + array.getNodeType());
        }
        for (JsonNode node : array) {
            values.add(readValue(node));
        }
        return values;
    }

    public static ParameterValue readValue(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Parameter value must be a JSON object");
        }
        ParameterValue value = new ParameterValue();
        value.mean = JsonNodeUtils.asNullableDouble(node.get("mean"));
        value.n = JsonNodeUtils.asNullableInt(node.get("n"));
        value.k = JsonNodeUtils.asNullableInt(node.get("k"));
        value.stdev = JsonNodeUtils.asNullableDouble(node.get("stdev"));
        value.dates = JsonNodeUtils.asTextList(node.get("dates"));
        value.nDaily = JsonNodeUtils.asIntList(node.get("n_daily"));
        value.kDaily = JsonNodeUtils.asIntList(node.get("k_daily"));
        value.windowFrom = JsonNodeUtils.asNullableText(node.get("window_from"));
        value.windowTo = JsonNodeUtils.asNullableText(node.get("window_to"));
        value.cohortFrom = JsonNodeUtils.asNullableText(node.get("cohort_from"));
        value.cohortTo = JsonNodeUtils.asNullableText(node.get("cohort_to"));
        value.sliceDsl = JsonNodeUtils.asNullableText(node.get("sliceDSL"));
        value.querySignature = JsonNodeUtils.asNullableText(node.get("query_signature"));
        value.forecast = JsonNodeUtils.asNullableDouble(node.get("forecast"));
        value.medianLagDays = JsonNodeUtils.asDoubleList(node.get("median_lag_days"));
        value.meanLagDays = JsonNodeUtils.asDoubleList(node.get("mean_lag_days"));
        value.anchorMedianLagDays = JsonNodeUtils.asDoubleList(node.get("anchor_median_lag_days"));
        value.anchorMeanLagDays = JsonNodeUtils.asDoubleList(node.get("anchor_mean_lag_days"));

        JsonNode latency = node.get("latency");
        if (latency != null && latency.isObject()) {
            value.latency = new ParameterValue.LatencySummary(
                    JsonNodeUtils.asNullableDouble(latency.get("median_lag_days")),
                    JsonNodeUtils.asNullableDouble(latency.get("mean_lag_days")));
        }
        JsonNode dataSource = node.get("data_source");
        if (dataSource != null && dataSource.isObject()) {
            ParameterValue.DataSource source = new ParameterValue.DataSource(
                    JsonNodeUtils.asNullableText(dataSource.get("type")),
                    JsonNodeUtils.asNullableText(dataSource.get("retrieved_at")));
            source.fullQuery = JsonNodeUtils.asNullableText(dataSource.get("full_query"));
            value.dataSource = source;
        }
        return value;
    }

    public static LatencyConfig readLatencyConfig(String json) {
        return readLatencyConfig(JsonSupport.readTree(json));
    }

    public static LatencyConfig readLatencyConfig(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        LatencyConfig config = new LatencyConfig();
        config.latencyParameter = JsonNodeUtils.asBooleanOrDefault(node.get("latency_parameter"), false);
        config.t95 = JsonNodeUtils.asNullableDouble(node.get("t95"));
        config.pathT95 = JsonNodeUtils.asNullableDouble(node.get("path_t95"));
        config.anchorNodeId = JsonNodeUtils.asNullableText(node.get("anchor_node_id"));
        return config;
    }

    public static ObjectNode toNode(ParameterValue value) {
        ObjectNode node = JsonSupport.MAPPER.createObjectNode();
        putNumber(node, "mean", value.mean);
        putInt(node, "n", value.n);
        putInt(node, "k", value.k);
        putNumber(node, "stdev", value.stdev);
        putTexts(node, "dates", value.dates);
        putInts(node, "n_daily", value.nDaily);
        putInts(node, "k_daily", value.kDaily);
        putText(node, "window_from", value.windowFrom);
        putText(node, "window_to", value.windowTo);
        putText(node, "cohort_from", value.cohortFrom);
        putText(node, "cohort_to", value.cohortTo);
        putText(node, "sliceDSL", value.sliceDsl);
        putText(node, "query_signature", value.querySignature);
        putNumber(node, "forecast", value.forecast);
        putNumbers(node, "median_lag_days", value.medianLagDays);
        putNumbers(node, "mean_lag_days", value.meanLagDays);
        putNumbers(node, "anchor_median_lag_days", value.anchorMedianLagDays);
        putNumbers(node, "anchor_mean_lag_days", value.anchorMeanLagDays);
        if (value.latency != null) {
            ObjectNode latency = node.putObject("latency");
            putNumber(latency, "median_lag_days", value.latency.medianLagDays);
            putNumber(latency, "mean_lag_days", value.latency.meanLagDays);
        }
        if (value.dataSource != null) {
            ObjectNode source = node.putObject("data_source");
            putText(source, "type", value.dataSource.type);
            putText(source, "retrieved_at", value.dataSource.retrievedAt);
            putText(source, "full_query", value.dataSource.fullQuery);
        }
        return node;
    }

    public static ArrayNode toArrayNode(List<ParameterValue> values) {
        ArrayNode array = JsonSupport.MAPPER.createArrayNode();
        for (ParameterValue value : values) {
            array.add(toNode(value));
        }
        return array;
    }

    public static String writeValues(List<ParameterValue> values) {
        return JsonSupport.toPrettyJson(toArrayNode(values));
    }

    /**
     * Replaces the {@code values} array of a parameter file, keeping its other fields and their order.
     */
    public static String writeParameterFile(JsonNode parameterFile, List<ParameterValue> values) {
        if (parameterFile == null || !parameterFile.isObject()) {
            throw new IllegalArgumentException("Parameter file must be a JSON object");
        }
        ObjectNode copy = ((ObjectNode) parameterFile).deepCopy();
        copy.set(VALUES, toArrayNode(values));
        return JsonSupport.toPrettyJson(copy);
    }

    private static void putText(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void putInt(ObjectNode node, String field, Integer value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void putNumber(ObjectNode node, String field, Double value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void putTexts(ObjectNode node, String field, List<String> values) {
        if (values == null) {
            return;
        }
        ArrayNode array = node.putArray(field);
        for (String value : values) {
            array.add(value);
        }
    }

    private static void putInts(ObjectNode node, String field, List<Integer> values) {
        if (values == null) {
            return;
        }
        ArrayNode array = node.putArray(field);
        for (Integer value : values) {
            array.add(value);
        }
    }

    private static void putNumbers(ObjectNode node, String field, List<Double> values) {
        if (values == null) {
            return;
        }
        ArrayNode array = node.putArray(field);
        for (Double value : values) {
            array.add(value);
        }
    }
}
