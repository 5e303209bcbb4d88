package com.dagnet.analytics.coverage;

import com.dagnet.analytics.model.DateRange;
import com.dagnet.analytics.model.ParameterValue;
import com.dagnet.analytics.slice.SliceDsl;
import com.dagnet.analytics.slice.SliceIsolation;
import com.dagnet.analytics.util.StringSemantics;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Header-only coverage: is the requested window inside the {@code *_from / *_to} span of a
 * slice in the target family? Per-day gaps, sparsity and maturity are ignored; this answers
 * "read from cache or offer a fetch".
 */
public final class SliceHeaderCoverage {
    private SliceHeaderCoverage() {}

    public static boolean hasFullCoverage(List<ParameterValue> values, DateRange requestedWindow, String targetSliceDsl) {
        if (values == null || values.isEmpty()) {
            return false;
        }
        if (requestedWindow == null) {
            throw new IllegalArgumentException("requestedWindow is required");
        }
        String target = StringSemantics.nullToEmpty(targetSliceDsl);

        List<ParameterValue> sameMode = new ArrayList<>();
        for (ParameterValue value : values) {
            if (SliceIsolation.matchesMode(value, target)) {
                sameMode.add(value);
            }
        }

        if (isMeceQuery(sameMode, target)) {
            TreeSet<String> partitions = new TreeSet<>();
            for (ParameterValue value : sameMode) {
                partitions.add(SliceIsolation.extractDimensions(value.sliceDsl));
            }
            for (String partition : partitions) {
                boolean covered = false;
                for (ParameterValue value : sameMode) {
                    if (partition.equals(SliceIsolation.extractDimensions(value.sliceDsl))
                            && covers(value, requestedWindow, target)) {
                        covered = true;
                        break;
                    }
                }
                if (!covered) {
                    return false;
                }
            }
            return true;
        }

        for (ParameterValue value : SliceIsolation.isolate(sameMode, target)) {
            if (covers(value, requestedWindow, target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * An uncontexted query over a file that holds only contexted slices: the answer has to be
     * assembled from every partition.
     */
    static boolean isMeceQuery(List<ParameterValue> values, String targetSliceDsl) {
        if (!SliceIsolation.extractDimensions(targetSliceDsl).isEmpty()) {
            return false;
        }
        List<ParameterValue> contexted = new ArrayList<>();
        for (ParameterValue value : values) {
            if (!SliceIsolation.isContexted(value)) {
                return false;
            }
            contexted.add(value);
        }
        return !contexted.isEmpty();
    }

    private static boolean covers(ParameterValue value, DateRange requestedWindow, String targetSliceDsl) {
        String from;
        String to;
        if (SliceDsl.isCohort(targetSliceDsl)) {
            from = StringSemantics.firstPresent(value.cohortFrom, value.windowFrom);
            to = StringSemantics.firstPresent(value.cohortTo, value.windowTo);
        } else {
            from = StringSemantics.firstPresent(value.windowFrom, value.cohortFrom);
            to = StringSemantics.firstPresent(value.windowTo, value.cohortTo);
        }
        if (from == null || to == null) {
            return false;
        }
        return DateRange.of(from, to).containsRange(requestedWindow);
    }
}
