package com.dagnet.analytics.slice;

import com.dagnet.analytics.model.ParameterValue;
import com.dagnet.analytics.util.StringSemantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Resolves the context/case dimensions of a slice DSL and filters slices to a query's family.
 *
 * <p>Dimension identity is the sorted list of {@code context(...)} and {@code case(...)} clauses,
 * joined with {@code .}. Date-range clauses ({@code window(...)}, {@code cohort(...)}) and any
 * other query clauses do not take part in identity.
 * </p>
 */
public final class SliceIsolation {
    private SliceIsolation() {}

    public static String extractDimensions(String sliceDsl) {
        if (StringSemantics.isBlank(sliceDsl)) {
            return "";
        }
        List<String> dims = new ArrayList<>();
        for (String clause : splitClauses(sliceDsl)) {
            if (isDimensionClause(clause)) {
                dims.add(clause);
            }
        }
        if (dims.isEmpty()) {
            return "";
        }
        Collections.sort(dims);
        return String.join(".", dims);
    }

    public static boolean isContexted(ParameterValue value) {
        return !extractDimensions(value.sliceDsl).isEmpty();
    }

    /**
     * Slices whose dimensions equal the query's. Mode is not considered here.
     */
    public static List<ParameterValue> isolate(List<ParameterValue> values, String querySliceDsl) {
        List<ParameterValue> matches = new ArrayList<>();
        if (values == null) {
            return matches;
        }
        String target = extractDimensions(querySliceDsl);
        for (ParameterValue value : values) {
            if (target.equals(extractDimensions(value.sliceDsl))) {
                matches.add(value);
            }
        }
        return matches;
    }

    /**
     * Mode filter: a target naming {@code cohort(} keeps cohort slices, one naming {@code window(}
     * keeps the rest. A target naming neither keeps everything.
     */
    public static boolean matchesMode(ParameterValue value, String targetSliceDsl) {
        if (SliceDsl.isCohort(targetSliceDsl)) {
            return value.isCohortMode();
        }
        if (SliceDsl.isWindow(targetSliceDsl)) {
            return !value.isCohortMode();
        }
        return true;
    }

    /**
     * Splits a DSL on top-level dots; dots inside parentheses belong to the clause.
     */
    static List<String> splitClauses(String dsl) {
        List<String> clauses = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < dsl.length(); i++) {
            char c = dsl.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (c == '.' && depth == 0) {
                addClause(clauses, dsl.substring(start, i));
                start = i + 1;
            }
        }
        addClause(clauses, dsl.substring(start));
        return clauses;
    }

    private static void addClause(List<String> clauses, String raw) {
        String trimmed = raw.trim();
        if (!trimmed.isEmpty()) {
            clauses.add(trimmed);
        }
    }

    private static boolean isDimensionClause(String clause) {
        return clause.startsWith("context(") || clause.startsWith("case(");
    }
}
