package com.dagnet.analytics.merge;

import com.dagnet.analytics.config.RefetchPolicyConfig;
import com.dagnet.analytics.maturity.MaturityModel;
import com.dagnet.analytics.model.DateRange;
import com.dagnet.analytics.model.LatencyConfig;
import com.dagnet.analytics.model.ParameterValue;
import com.dagnet.analytics.model.TimeSeriesPoint;
import com.dagnet.analytics.slice.SliceDays;
import com.dagnet.analytics.slice.SliceDsl;
import com.dagnet.analytics.slice.SliceFamily;
import com.dagnet.analytics.slice.SliceIsolation;
import com.dagnet.analytics.slice.SliceMode;
import com.dagnet.analytics.util.CalendarDates;
import com.dagnet.analytics.util.StringSemantics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds a fetch result into a parameter's slice list.
 *
 * <p>The target family is derived from the merge mode and the dimensions of the query DSL.
 * Every stored slice of that family is collapsed into one canonical slice holding the union of
 * stored and fetched days, with fetched days winning on collision. Slices of other families are
 * passed through untouched and keep their order; the merged slice is appended.</p>
 *
 * <p>Window and cohort families merge the same way; cohort history is never dropped.</p>
 */
public final class TimeSeriesMerger {
    private static final Logger LOG = LoggerFactory.getLogger(TimeSeriesMerger.class);

    private TimeSeriesMerger() {}

    public static List<ParameterValue> merge(
            List<ParameterValue> existing,
            List<TimeSeriesPoint> newPoints,
            DateRange newWindow,
            String querySignature,
            String sliceDsl,
            MergeOptions options) {
        return merge(existing, newPoints, newWindow, querySignature, sliceDsl, options, RefetchPolicyConfig.defaults());
    }

    public static List<ParameterValue> merge(
            List<ParameterValue> existing,
            List<TimeSeriesPoint> newPoints,
            DateRange newWindow,
            String querySignature,
            String sliceDsl,
            MergeOptions options,
            RefetchPolicyConfig config) {
        List<ParameterValue> current = existing == null ? new ArrayList<>() : existing;
        if (newPoints == null || newPoints.isEmpty()) {
            LOG.debug("Empty fetch result for {}; slices unchanged", sliceDsl);
            return current;
        }
        if (options == null) {
            throw new IllegalArgumentException("options are required");
        }

        SliceMode mode = options.cohortMode ? SliceMode.COHORT : SliceMode.WINDOW;
        SliceFamily family = SliceFamily.of(mode, SliceIsolation.extractDimensions(sliceDsl));

        List<ParameterValue> untouched = new ArrayList<>();
        List<ParameterValue> familySlices = new ArrayList<>();
        for (ParameterValue value : current) {
            if (family.contains(value)) {
                familySlices.add(value);
            } else {
                untouched.add(value);
            }
        }

        TreeMap<LocalDate, DayEntry> days = new TreeMap<>();
        for (ParameterValue value : familySlices) {
            seed(days, value);
        }
        for (TimeSeriesPoint point : newPoints) {
            LocalDate day = CalendarDates.parse(point.date);
            if (newWindow != null && !newWindow.contains(day)) {
                LOG.warn("Fetched point {} lies outside fetch window {} for {}", point.date, newWindow, family);
            }
            days.put(day, DayEntry.of(point));
        }

        ParameterValue merged = build(days, family, familySlices, querySignature, options, config);
        List<ParameterValue> result = new ArrayList<>(untouched);
        result.add(merged);
        LOG.debug("Merged {} fetched points into {} ({} stored slices collapsed, {} days)",
                newPoints.size(), merged.sliceDsl, familySlices.size(), merged.dateCount());
        return result;
    }

    // Earlier slices win among stored slices; fetched points overwrite afterwards.
    private static void seed(Map<LocalDate, DayEntry> days, ParameterValue value) {
        if (value.dates == null) {
            return;
        }
        for (int i = 0; i < value.dates.size(); i++) {
            Integer n = SliceDays.valueAt(value.nDaily, i);
            Integer k = SliceDays.valueAt(value.kDaily, i);
            if (n == null && k == null) {
                continue;
            }
            LocalDate day = CalendarDates.parse(value.dates.get(i));
            if (days.containsKey(day)) {
                continue;
            }
            DayEntry entry = new DayEntry(n == null ? 0 : n, k == null ? 0 : k);
            entry.medianLag = SliceDays.valueAt(value.medianLagDays, i);
            entry.meanLag = SliceDays.valueAt(value.meanLagDays, i);
            entry.anchorMedianLag = SliceDays.valueAt(value.anchorMedianLagDays, i);
            entry.anchorMeanLag = SliceDays.valueAt(value.anchorMeanLagDays, i);
            days.put(day, entry);
        }
    }

    private static ParameterValue build(
            TreeMap<LocalDate, DayEntry> days,
            SliceFamily family,
            List<ParameterValue> familySlices,
            String querySignature,
            MergeOptions options,
            RefetchPolicyConfig config) {
        List<LocalDate> sortedDays = new ArrayList<>(days.keySet());
        List<String> dates = new ArrayList<>();
        List<Integer> nDaily = new ArrayList<>();
        List<Integer> kDaily = new ArrayList<>();
        List<Double> medianLag = new ArrayList<>();
        List<Double> meanLag = new ArrayList<>();
        List<Double> anchorMedianLag = new ArrayList<>();
        List<Double> anchorMeanLag = new ArrayList<>();
        long totalN = 0L;
        long totalK = 0L;
        for (Map.Entry<LocalDate, DayEntry> e : days.entrySet()) {
            DayEntry entry = e.getValue();
            String date = CalendarDates.format(e.getKey());
            if (entry.k > entry.n) {
                LOG.warn("Inconsistent daily counts for {} on {}: k={} exceeds n={}", family, date, entry.k, entry.n);
            }
            dates.add(date);
            nDaily.add(entry.n);
            kDaily.add(entry.k);
            medianLag.add(entry.medianLag);
            meanLag.add(entry.meanLag);
            anchorMedianLag.add(entry.anchorMedianLag);
            anchorMeanLag.add(entry.anchorMeanLag);
            totalN += entry.n;
            totalK += entry.k;
        }

        ParameterValue merged = new ParameterValue();
        merged.n = storedCount(totalN, "n", family);
        merged.k = storedCount(totalK, "k", family);
        merged.mean = roundedMean(totalN, totalK);
        merged.dates = dates;
        merged.nDaily = nDaily;
        merged.kDaily = kDaily;
        merged.medianLagDays = anyPresent(medianLag) ? medianLag : null;
        merged.meanLagDays = anyPresent(meanLag) ? meanLag : null;
        merged.anchorMedianLagDays = anyPresent(anchorMedianLag) ? anchorMedianLag : null;
        merged.anchorMeanLagDays = anyPresent(anchorMeanLag) ? anchorMeanLag : null;
        merged.querySignature = querySignature;

        LocalDate from = sortedDays.get(0);
        LocalDate to = sortedDays.get(sortedDays.size() - 1);
        if (family.mode() == SliceMode.COHORT) {
            merged.cohortFrom = CalendarDates.format(from);
            merged.cohortTo = CalendarDates.format(to);
            merged.sliceDsl = SliceDsl.cohort(anchorFor(options, familySlices), from, to, family.dimensions());
        } else {
            merged.windowFrom = CalendarDates.format(from);
            merged.windowTo = CalendarDates.format(to);
            merged.sliceDsl = SliceDsl.window(from, to, family.dimensions());
            merged.forecast = forecastFor(sortedDays, nDaily, kDaily, familySlices, options, config);
        }

        if (options.latencySummary != null) {
            merged.latency = options.latencySummary.copy();
        } else {
            ParameterValue.LatencySummary previous = previousLatency(familySlices);
            merged.latency = previous == null ? null : previous.copy();
        }

        ParameterValue.DataSource dataSource = new ParameterValue.DataSource(
                options.dataSourceType, options.referenceDate.toString());
        dataSource.fullQuery = StringSemantics.blankToNull(options.fullQuery);
        merged.dataSource = dataSource;
        return merged;
    }

    /**
     * {@code round(k/n, 3)}; 0 when there is no exposure.
     */
    static double roundedMean(long n, long k) {
        if (n <= 0) {
            return 0.0;
        }
        return Math.round((double) k / n * 1000.0) / 1000.0;
    }

    // Stored totals are 32-bit in parameter files.
    private static int storedCount(long total, String field, SliceFamily family) {
        if (total > Integer.MAX_VALUE || total < Integer.MIN_VALUE) {
            throw new IllegalArgumentException("Merged total " + field + "=" + total + " for " + family
                    + " exceeds the stored integer range");
        }
        return (int) total;
    }

    private static Double forecastFor(
            List<LocalDate> days,
            List<Integer> nDaily,
            List<Integer> kDaily,
            List<ParameterValue> familySlices,
            MergeOptions options,
            RefetchPolicyConfig config) {
        Double previous = previousForecast(familySlices);
        if (!options.recomputeForecast || !LatencyConfig.isEnabled(options.latencyConfig)) {
            return previous;
        }
        int maturityDays = MaturityModel.effectiveMaturity(options.latencyConfig, false, config);
        Double estimate = ForecastEstimator.estimate(days, nDaily, kDaily, maturityDays,
                CalendarDates.utcDate(options.referenceDate), config.recencyHalfLifeDays);
        if (estimate == null) {
            LOG.debug("No settled days for forecast (maturity {} days); keeping previous forecast {}",
                    maturityDays, previous);
            return previous;
        }
        return estimate;
    }

    private static Double previousForecast(List<ParameterValue> familySlices) {
        for (ParameterValue value : familySlices) {
            if (value.forecast != null) {
                return value.forecast;
            }
        }
        return null;
    }

    private static ParameterValue.LatencySummary previousLatency(List<ParameterValue> familySlices) {
        for (ParameterValue value : familySlices) {
            if (value.latency != null) {
                return value.latency;
            }
        }
        return null;
    }

    private static String anchorFor(MergeOptions options, List<ParameterValue> familySlices) {
        if (options.latencyConfig != null && !StringSemantics.isBlank(options.latencyConfig.anchorNodeId)) {
            return options.latencyConfig.anchorNodeId;
        }
        for (ParameterValue value : familySlices) {
            String anchor = SliceDsl.anchorOf(value.sliceDsl);
            if (anchor != null) {
                return anchor;
            }
        }
        return null;
    }

    private static boolean anyPresent(List<Double> values) {
        for (Double value : values) {
            if (value != null) {
                return true;
            }
        }
        return false;
    }

    private static final class DayEntry {
        final int n;
        final int k;
        Double medianLag;
        Double meanLag;
        Double anchorMedianLag;
        Double anchorMeanLag;

        DayEntry(int n, int k) {
            this.n = n;
            this.k = k;
        }

        static DayEntry of(TimeSeriesPoint point) {
            DayEntry entry = new DayEntry(point.n, point.k);
            entry.medianLag = point.medianLagDays;
            entry.meanLag = point.meanLagDays;
            entry.anchorMedianLag = point.anchorMedianLagDays;
            entry.anchorMeanLag = point.anchorMeanLagDays;
            return entry;
        }
    }
}
