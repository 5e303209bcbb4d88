package com.dagnet.analytics.coverage;

import com.dagnet.analytics.model.DateRange;
import com.dagnet.analytics.model.ParameterValue;
import com.dagnet.analytics.slice.SliceIsolation;
import com.dagnet.analytics.slice.SliceDays;
import com.dagnet.analytics.util.StringSemantics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reconciles a requested window against every stored slice of a parameter and reports the
 * days still to fetch, grouped into contiguous fetch windows.
 *
 * <p>Evaluation order:</p>
 * <ol>
 *   <li>{@code bustCache} marks every requested day missing.</li>
 *   <li>Candidate slices are narrowed by mode, then by query signature when the caller passes
 *       one and the file carries any.</li>
 *   <li>An uncontexted query over contexted-only candidates is a MECE aggregation: a day is
 *       available only when every partition has it. Partitions are the contexted same-mode slices
 *       before signature filtering, so a partition with only stale signatures leaves every day
 *       missing. The aggregate fast path never applies here.</li>
 *   <li>Otherwise a family slice with aggregate totals whose header span contains the window
 *       short-circuits to fully cached.</li>
 *   <li>Otherwise days with a daily count in any family slice are available.</li>
 * </ol>
 */
public final class IncrementalFetchPlanner {
    private static final Logger LOG = LoggerFactory.getLogger(IncrementalFetchPlanner.class);

    private IncrementalFetchPlanner() {}

    public static IncrementalFetchResult calculateIncrementalFetch(
            List<ParameterValue> values,
            DateRange requestedWindow,
            String querySignature,
            boolean bustCache,
            String targetSliceDsl) {
        if (requestedWindow == null) {
            throw new IllegalArgumentException("requestedWindow is required");
        }
        List<LocalDate> requestedDays = requestedWindow.days();
        String target = StringSemantics.nullToEmpty(targetSliceDsl);

        if (bustCache) {
            LOG.debug("Cache bust requested for {}: fetching all {} days", requestedWindow, requestedDays.size());
            return result(IncrementalFetchResult.REASON_BUST_CACHE, requestedDays, Collections.emptySet(),
                    Collections.emptyList());
        }

        List<ParameterValue> sameMode = modeMatches(values, target);
        List<ParameterValue> candidates = signatureMatches(values, sameMode, querySignature);

        if (SliceHeaderCoverage.isMeceQuery(candidates, target)) {
            // Partitions come from every same-mode slice; a partition whose slices were all
            // dropped by the signature filter contributes no days.
            Map<String, Set<LocalDate>> daysByPartition = new TreeMap<>();
            for (ParameterValue value : sameMode) {
                if (SliceIsolation.isContexted(value)) {
                    daysByPartition.put(SliceIsolation.extractDimensions(value.sliceDsl), new HashSet<>());
                }
            }
            for (ParameterValue value : candidates) {
                daysByPartition.get(SliceIsolation.extractDimensions(value.sliceDsl))
                        .addAll(SliceDays.daysWithData(value));
            }
            List<String> partitions = new ArrayList<>(daysByPartition.keySet());
            Set<LocalDate> available = new HashSet<>();
            for (LocalDate day : requestedDays) {
                boolean everyPartition = true;
                for (Set<LocalDate> partitionDays : daysByPartition.values()) {
                    if (!partitionDays.contains(day)) {
                        everyPartition = false;
                        break;
                    }
                }
                if (everyPartition) {
                    available.add(day);
                }
            }
            LOG.debug("MECE aggregation over partitions {} for {}: {} of {} days covered",
                    partitions, requestedWindow, available.size(), requestedDays.size());
            return result(IncrementalFetchResult.REASON_MECE, requestedDays, available, partitions);
        }

        List<ParameterValue> family = SliceIsolation.isolate(candidates, target);
        for (ParameterValue value : family) {
            if (value.hasAggregate() && headerContains(value, requestedWindow)) {
                LOG.debug("Aggregate fast path for {} on slice {}", requestedWindow, value.sliceDsl);
                return result(IncrementalFetchResult.REASON_FAST_PATH, requestedDays, new HashSet<>(requestedDays),
                        Collections.emptyList());
            }
        }

        Set<LocalDate> available = new HashSet<>();
        for (ParameterValue value : family) {
            available.addAll(SliceDays.daysWithData(value));
        }
        return result(IncrementalFetchResult.REASON_INCREMENTAL, requestedDays, available, Collections.emptyList());
    }

    private static List<ParameterValue> modeMatches(List<ParameterValue> values, String target) {
        List<ParameterValue> matches = new ArrayList<>();
        if (values == null) {
            return matches;
        }
        for (ParameterValue value : values) {
            if (SliceIsolation.matchesMode(value, target)) {
                matches.add(value);
            }
        }
        return matches;
    }

    // Applies only when the caller passes a signature and the file carries any.
    private static List<ParameterValue> signatureMatches(
            List<ParameterValue> values, List<ParameterValue> sameMode, String querySignature) {
        boolean filterBySignature = false;
        if (values != null && !StringSemantics.isBlank(querySignature)) {
            for (ParameterValue value : values) {
                if (!StringSemantics.isBlank(value.querySignature)) {
                    filterBySignature = true;
                    break;
                }
            }
        }
        if (!filterBySignature) {
            return sameMode;
        }
        List<ParameterValue> matches = new ArrayList<>();
        for (ParameterValue value : sameMode) {
            if (StringSemantics.sameNonBlank(querySignature, value.querySignature)) {
                matches.add(value);
            }
        }
        if (matches.size() < sameMode.size()) {
            LOG.debug("Signature filter kept {} of {} slices", matches.size(), sameMode.size());
        }
        return matches;
    }

    private static boolean headerContains(ParameterValue value, DateRange requestedWindow) {
        String[] header = value.headerRange();
        return header != null && DateRange.of(header[0], header[1]).containsRange(requestedWindow);
    }

    private static IncrementalFetchResult result(
            String reason,
            List<LocalDate> requestedDays,
            Set<LocalDate> available,
            List<String> partitions) {
        SortedSet<LocalDate> existing = new TreeSet<>();
        List<LocalDate> missing = new ArrayList<>();
        for (LocalDate day : requestedDays) {
            if (available.contains(day)) {
                existing.add(day);
            } else {
                missing.add(day);
            }
        }
        return new IncrementalFetchResult(reason, existing, missing, requestedDays.size(), partitions);
    }
}
