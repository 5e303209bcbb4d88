package com.dagnet.analytics.slice;

import com.dagnet.analytics.model.DateRange;
import com.dagnet.analytics.util.CalendarDates;
import com.dagnet.analytics.util.StringSemantics;

import java.time.LocalDate;

/**
 * Generates and reads the canonical slice identity text:
 * {@code window(<from>:<to>)[.context(...)]} or {@code cohort([<anchor>,]<from>:<to>)[.context(...)]}.
 */
public final class SliceDsl {
    private SliceDsl() {}

    public static String window(LocalDate from, LocalDate to, String dimensions) {
        return "window(" + CalendarDates.format(from) + ":" + CalendarDates.format(to) + ")"
                + suffix(dimensions);
    }

    public static String cohort(String anchorNodeId, LocalDate from, LocalDate to, String dimensions) {
        String anchorPart = StringSemantics.isBlank(anchorNodeId) ? "" : anchorNodeId.trim() + ",";
        return "cohort(" + anchorPart + CalendarDates.format(from) + ":" + CalendarDates.format(to) + ")"
                + suffix(dimensions);
    }

    public static String canonical(SliceMode mode, String anchorNodeId, LocalDate from, LocalDate to, String dimensions) {
        return mode == SliceMode.COHORT
                ? cohort(anchorNodeId, from, to, dimensions)
                : window(from, to, dimensions);
    }

    public static boolean isCohort(String sliceDsl) {
        return sliceDsl != null && sliceDsl.contains("cohort(");
    }

    public static boolean isWindow(String sliceDsl) {
        return sliceDsl != null && sliceDsl.contains("window(");
    }

    /**
     * Anchor node id of a {@code cohort(anchor,from:to)} clause, or null when absent.
     */
    public static String anchorOf(String sliceDsl) {
        String args = rangeArguments(sliceDsl, SliceMode.COHORT);
        if (args == null) {
            return null;
        }
        int comma = args.indexOf(',');
        if (comma < 0) {
            return null;
        }
        return StringSemantics.trimToNull(args.substring(0, comma));
    }

    /**
     * Absolute date range of the window/cohort clause, or null when the clause is missing or
     * its bounds are not calendar dates (open-ended or relative ranges).
     */
    public static DateRange rangeOf(String sliceDsl) {
        SliceMode mode = isCohort(sliceDsl) ? SliceMode.COHORT : SliceMode.WINDOW;
        String args = rangeArguments(sliceDsl, mode);
        if (args == null) {
            return null;
        }
        int comma = args.indexOf(',');
        String range = comma >= 0 ? args.substring(comma + 1) : args;
        int colon = range.indexOf(':');
        if (colon < 0) {
            return null;
        }
        String from = range.substring(0, colon).trim();
        String to = range.substring(colon + 1).trim();
        if (!CalendarDates.looksLikeDate(from) || !CalendarDates.looksLikeDate(to)) {
            return null;
        }
        return DateRange.of(from, to);
    }

    private static String rangeArguments(String sliceDsl, SliceMode mode) {
        if (sliceDsl == null) {
            return null;
        }
        String open = mode.function() + "(";
        int start = sliceDsl.indexOf(open);
        if (start < 0) {
            return null;
        }
        int end = sliceDsl.indexOf(')', start);
        if (end < 0) {
            return null;
        }
        return sliceDsl.substring(start + open.length(), end);
    }

    private static String suffix(String dimensions) {
        return StringSemantics.isBlank(dimensions) ? "" : "." + dimensions.trim();
    }
}
