package com.dagnet.analytics.coverage;

import com.dagnet.analytics.model.DateRange;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;

/**
 * Which requested days are already cached and which contiguous windows must be fetched.
 */
public final class IncrementalFetchResult {
    public static final String REASON_BUST_CACHE = "bust_cache";
    public static final String REASON_FAST_PATH = "fast_path_aggregate_coverage";
    public static final String REASON_MECE = "mece_aggregation";
    public static final String REASON_INCREMENTAL = "incremental";

    public final String reason;
    public final SortedSet<LocalDate> existingDates;
    public final List<LocalDate> missingDates;
    // One entry per contiguous gap; each becomes an independent fetch request.
    public final List<DateRange> fetchWindows;
    // Span of all missing days, null when nothing is missing.
    public final DateRange fetchWindow;
    public final boolean needsFetch;
    public final int totalDays;
    public final int daysAvailable;
    public final int daysToFetch;
    // Context partitions consulted under MECE aggregation; empty otherwise.
    public final List<String> mecePartitions;

    IncrementalFetchResult(
            String reason,
            SortedSet<LocalDate> existingDates,
            List<LocalDate> missingDates,
            int totalDays,
            List<String> mecePartitions) {
        this.reason = reason;
        this.existingDates = Collections.unmodifiableSortedSet(existingDates);
        this.missingDates = Collections.unmodifiableList(missingDates);
        this.fetchWindows = Collections.unmodifiableList(DateGaps.contiguousRanges(missingDates));
        this.fetchWindow = DateGaps.span(missingDates);
        this.needsFetch = !missingDates.isEmpty();
        this.totalDays = totalDays;
        this.daysAvailable = existingDates.size();
        this.daysToFetch = missingDates.size();
        this.mecePartitions = Collections.unmodifiableList(mecePartitions);
    }

    @Override
    public String toString() {
        return "IncrementalFetchResult{reason=" + reason
                + ", available=" + daysAvailable + "/" + totalDays
                + ", fetchWindows=" + fetchWindows + "}";
    }
}
