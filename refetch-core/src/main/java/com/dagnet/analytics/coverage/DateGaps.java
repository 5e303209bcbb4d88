package com.dagnet.analytics.coverage;

import com.dagnet.analytics.model.DateRange;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Day-set algebra shared by coverage analysis, incremental fetch and window aggregation.
 */
public final class DateGaps {
    private DateGaps() {}

    /**
     * Groups days into contiguous ranges, sorted chronologically; input order and duplicates
     * do not matter.
     */
    public static List<DateRange> contiguousRanges(Collection<LocalDate> days) {
        if (days == null || days.isEmpty()) {
            return Collections.emptyList();
        }
        List<DateRange> ranges = new ArrayList<>();
        LocalDate rangeStart = null;
        LocalDate previous = null;
        for (LocalDate day : new TreeSet<>(days)) {
            if (previous != null && !day.equals(previous.plusDays(1))) {
                ranges.add(DateRange.of(rangeStart, previous));
                rangeStart = null;
            }
            if (rangeStart == null) {
                rangeStart = day;
            }
            previous = day;
        }
        ranges.add(DateRange.of(rangeStart, previous));
        return ranges;
    }

    /**
     * Days of the window that are not in {@code available}, in calendar order.
     */
    public static List<LocalDate> missingDays(DateRange window, Set<LocalDate> available) {
        List<LocalDate> missing = new ArrayList<>();
        for (LocalDate day : window.days()) {
            if (!available.contains(day)) {
                missing.add(day);
            }
        }
        return missing;
    }

    /**
     * Smallest range spanning all days, or null for an empty collection.
     */
    public static DateRange span(Collection<LocalDate> days) {
        if (days == null || days.isEmpty()) {
            return null;
        }
        TreeSet<LocalDate> sorted = new TreeSet<>(days);
        return DateRange.of(sorted.first(), sorted.last());
    }
}
