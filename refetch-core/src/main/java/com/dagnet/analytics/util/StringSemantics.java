package com.dagnet.analytics.util;

/**
 * Blank handling for optional slice fields (headers, signatures, anchors, DSL fragments).
 * Parameter files written by different tools use absent, null and "" interchangeably.
 */
public final class StringSemantics {
    private StringSemantics() {}

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }

    public static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    public static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    public static String firstNonBlank(String... values) {
        String present = firstPresent(values);
        return present == null ? "" : present;
    }

    /**
     * Like {@link #firstNonBlank(String...)} but null when every candidate is blank, for header
     * fields where absence must stay distinguishable.
     */
    public static String firstPresent(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }

    /**
     * Both values present and equal once trimmed. Two blanks never match.
     */
    public static boolean sameNonBlank(String left, String right) {
        return !isBlank(left) && !isBlank(right) && left.trim().equals(right.trim());
    }
}
