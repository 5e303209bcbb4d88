package com.dagnet.analytics.merge;

import com.dagnet.analytics.TestSlices;
import com.dagnet.analytics.model.DateRange;
import com.dagnet.analytics.model.LatencyConfig;
import com.dagnet.analytics.model.ParameterValue;
import com.dagnet.analytics.model.TimeSeriesPoint;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimeSeriesMergerTest {

    private static final Instant REFERENCE = Instant.parse("2025-12-17T12:00:00Z");
    private static final MergeOptions WINDOW = MergeOptions.window(REFERENCE).build();

    private static ParameterValue last(List<ParameterValue> values) {
        return values.get(values.size() - 1);
    }

    private static void assertAggregatesConsistent(ParameterValue value) {
        int n = 0;
        int k = 0;
        for (int i = 0; i < value.dates.size(); i++) {
            n += value.nDaily.get(i);
            k += value.kDaily.get(i);
        }
        assertEquals(n, value.n.intValue());
        assertEquals(k, value.k.intValue());
        assertEquals(Math.round((double) k / n * 1000.0) / 1000.0, value.mean, 0.0);
        assertEquals(value.dates.get(0), value.windowFrom == null ? value.cohortFrom : value.windowFrom);
        assertEquals(value.dates.get(value.dates.size() - 1), value.windowTo == null ? value.cohortTo : value.windowTo);
    }

    @Test
    void newFetchOverwritesOverlappingDaysAndTotalsFollow() {
        List<ParameterValue> existing = Collections.singletonList(TestSlices.windowSlice("1-Dec-25", "10-Dec-25", ""));

        List<ParameterValue> merged = TimeSeriesMerger.merge(existing, TestSlices.points("8-Dec-25", "12-Dec-25", 200, 50),
                DateRange.of("8-Dec-25", "12-Dec-25"), "sig-1", "window(8-Dec-25:12-Dec-25)", WINDOW);

        assertEquals(1, merged.size());
        ParameterValue value = merged.get(0);
        assertEquals(12, value.dates.size());
        assertEquals(1700, value.n.intValue());
        assertEquals(320, value.k.intValue());
        assertEquals(0.188, value.mean, 0.0);
        assertEquals(200, value.nDaily.get(value.dates.indexOf("8-Dec-25")).intValue());
        assertEquals(100, value.nDaily.get(value.dates.indexOf("7-Dec-25")).intValue());
        assertEquals("window(1-Dec-25:12-Dec-25)", value.sliceDsl);
        assertEquals("sig-1", value.querySignature);
        assertNull(value.cohortFrom);
        assertAggregatesConsistent(value);
    }

    @Test
    void sameFamilyCollapsesToOneSliceAndOtherFamiliesAreUntouched() {
        ParameterValue googleA = TestSlices.windowSlice("1-Dec-25", "5-Dec-25", "context(channel:google)");
        ParameterValue meta = TestSlices.windowSlice("1-Dec-25", "5-Dec-25", "context(channel:meta)");
        ParameterValue googleB = TestSlices.windowSlice("4-Dec-25", "8-Dec-25", "context(channel:google)");
        ParameterValue googleCohort = TestSlices.cohortSlice("landing", "1-Dec-25", "5-Dec-25", "context(channel:google)");
        List<ParameterValue> existing = Arrays.asList(googleA, meta, googleB, googleCohort);

        List<ParameterValue> merged = TimeSeriesMerger.merge(existing, TestSlices.points("9-Dec-25", "10-Dec-25", 100, 10),
                DateRange.of("9-Dec-25", "10-Dec-25"), null,
                "window(9-Dec-25:10-Dec-25).context(channel:google)", WINDOW);

        assertEquals(3, merged.size());
        assertSame(meta, merged.get(0));
        assertSame(googleCohort, merged.get(1));
        ParameterValue google = merged.get(2);
        assertEquals("window(1-Dec-25:10-Dec-25).context(channel:google)", google.sliceDsl);
        assertEquals(10, google.dates.size());
        assertAggregatesConsistent(google);
    }

    @Test
    void datesAreChronologicalWhateverTheInputOrder() {
        List<TimeSeriesPoint> points = new ArrayList<>(TestSlices.points("1-Nov-25", "12-Nov-25", 10, 1));
        Collections.reverse(points);
        points.add(0, new TimeSeriesPoint("2025-11-02", 20, 2));

        ParameterValue value = last(TimeSeriesMerger.merge(new ArrayList<>(), points,
                DateRange.of("1-Nov-25", "12-Nov-25"), null, "", WINDOW));

        assertEquals("1-Nov-25", value.dates.get(0));
        assertEquals("2-Nov-25", value.dates.get(1));
        assertEquals("10-Nov-25", value.dates.get(9));
        assertEquals("12-Nov-25", value.windowTo);
        assertAggregatesConsistent(value);
    }

    @Test
    void remergingIdenticalInputIsIdempotent() {
        List<ParameterValue> existing = Collections.singletonList(TestSlices.windowSlice("1-Dec-25", "10-Dec-25", ""));
        List<TimeSeriesPoint> points = TestSlices.points("8-Dec-25", "12-Dec-25", 200, 50);
        MergeOptions options = MergeOptions.window(REFERENCE)
                .latencyConfig(LatencyConfig.enabled(3.0))
                .recomputeForecast(true)
                .build();

        List<ParameterValue> once = TimeSeriesMerger.merge(existing, points,
                DateRange.of("8-Dec-25", "12-Dec-25"), "sig", "window(8-Dec-25:12-Dec-25)", options);
        List<ParameterValue> twice = TimeSeriesMerger.merge(once, points,
                DateRange.of("8-Dec-25", "12-Dec-25"), "sig", "window(8-Dec-25:12-Dec-25)", options);

        assertEquals(1, twice.size());
        assertEquals(once.get(0).sliceDsl, twice.get(0).sliceDsl);
        assertEquals(once.get(0).n, twice.get(0).n);
        assertEquals(once.get(0).k, twice.get(0).k);
        assertEquals(once.get(0).mean, twice.get(0).mean);
        assertEquals(once.get(0).forecast, twice.get(0).forecast);
        assertEquals(once.get(0).dates, twice.get(0).dates);
    }

    @Test
    void cohortMergeKeepsHistoryAndWidensSpan() {
        List<ParameterValue> existing = Collections.singletonList(
                TestSlices.cohortSlice("landing", "1-Nov-25", "10-Nov-25", ""));

        ParameterValue value = last(TimeSeriesMerger.merge(existing, TestSlices.points("1-Dec-25", "5-Dec-25", 40, 4),
                DateRange.of("1-Dec-25", "5-Dec-25"), null, "cohort(1-Dec-25:5-Dec-25)",
                MergeOptions.cohort(REFERENCE).build()));

        assertEquals("1-Nov-25", value.cohortFrom);
        assertEquals("5-Dec-25", value.cohortTo);
        assertEquals(15, value.dates.size());
        assertEquals("cohort(landing,1-Nov-25:5-Dec-25)", value.sliceDsl);
        assertNull(value.windowFrom);
        assertNull(value.forecast);
        assertAggregatesConsistent(value);
    }

    @Test
    void cohortAnchorPrefersLatencyConfig() {
        List<ParameterValue> existing = Collections.singletonList(
                TestSlices.cohortSlice("landing", "1-Nov-25", "10-Nov-25", "context(channel:google)"));
        MergeOptions options = MergeOptions.cohort(REFERENCE)
                .latencyConfig(LatencyConfig.enabled(5.0, 9.0, "signup"))
                .latencySummary(new ParameterValue.LatencySummary(2.5, 3.1))
                .build();

        ParameterValue value = last(TimeSeriesMerger.merge(existing, TestSlices.points("11-Nov-25", "12-Nov-25", 40, 4),
                DateRange.of("11-Nov-25", "12-Nov-25"), null, "cohort(-30d:).context(channel:google)", options));

        assertEquals("cohort(signup,1-Nov-25:12-Nov-25).context(channel:google)", value.sliceDsl);
        assertEquals(2.5, value.latency.medianLagDays, 0.0);
    }

    @Test
    void lagArraysAlignWithMergedDates() {
        List<TimeSeriesPoint> points = TestSlices.points("1-Dec-25", "3-Dec-25", 40, 4);
        points.get(1).withLag(1.5, 2.0).withAnchorLag(4.0, 4.5);

        ParameterValue value = last(TimeSeriesMerger.merge(
                Collections.singletonList(TestSlices.cohortSlice(null, "28-Nov-25", "30-Nov-25", "")),
                points, DateRange.of("1-Dec-25", "3-Dec-25"), null, "cohort(1-Dec-25:3-Dec-25)",
                MergeOptions.cohort(REFERENCE).build()));

        assertEquals(6, value.medianLagDays.size());
        assertEquals(6, value.anchorMeanLagDays.size());
        int index = value.dates.indexOf("2-Dec-25");
        assertEquals(1.5, value.medianLagDays.get(index), 0.0);
        assertEquals(2.0, value.meanLagDays.get(index), 0.0);
        assertEquals(4.5, value.anchorMeanLagDays.get(index), 0.0);
        assertNull(value.medianLagDays.get(0));
    }

    @Test
    void emptyFetchLeavesSlicesUnchanged() {
        List<ParameterValue> existing = Collections.singletonList(TestSlices.windowSlice("1-Dec-25", "10-Dec-25", ""));
        assertSame(existing, TimeSeriesMerger.merge(existing, Collections.emptyList(),
                DateRange.of("1-Dec-25", "10-Dec-25"), null, "", WINDOW));
    }

    @Test
    void provenanceComesFromOptions() {
        MergeOptions options = MergeOptions.window(REFERENCE).fullQuery("from(a).to(b)").build();

        ParameterValue value = last(TimeSeriesMerger.merge(new ArrayList<>(), TestSlices.points("1-Dec-25", "2-Dec-25", 5, 1),
                DateRange.of("1-Dec-25", "2-Dec-25"), null, "", options));

        assertEquals("api", value.dataSource.type);
        assertEquals("2025-12-17T12:00:00Z", value.dataSource.retrievedAt);
        assertEquals("from(a).to(b)", value.dataSource.fullQuery);
    }

    @Test
    void inconsistentDaysAreMergedNotRejected() {
        List<TimeSeriesPoint> points = Arrays.asList(new TimeSeriesPoint("1-Dec-25", 5, 8));

        ParameterValue value = last(TimeSeriesMerger.merge(new ArrayList<>(), points,
                DateRange.of("1-Dec-25", "1-Dec-25"), null, "", WINDOW));

        assertEquals(1.6, value.mean, 0.0);
    }

    @Test
    void forecastUsesSettledDaysOnly() {
        ParameterValue existing = TestSlices.windowSlice("1-Dec-25", "10-Dec-25", "");
        existing.forecast = 0.42;
        MergeOptions recompute = MergeOptions.window(REFERENCE)
                .latencyConfig(LatencyConfig.enabled(7.0))
                .recomputeForecast(true)
                .build();

        ParameterValue value = last(TimeSeriesMerger.merge(Collections.singletonList(existing),
                TestSlices.points("11-Dec-25", "16-Dec-25", 100, 90),
                DateRange.of("11-Dec-25", "16-Dec-25"), null, "", recompute));

        // Only 1-Dec..9-Dec are at least eight days old; each converts at 10%.
        assertEquals(0.1, value.forecast, 1e-12);
    }

    @Test
    void forecastIsPreservedWithoutSettledDaysOrWhenNotRequested() {
        ParameterValue existing = TestSlices.windowSlice("12-Dec-25", "13-Dec-25", "");
        existing.forecast = 0.42;
        MergeOptions recompute = MergeOptions.window(REFERENCE)
                .latencyConfig(LatencyConfig.enabled(7.0))
                .recomputeForecast(true)
                .build();

        ParameterValue immature = last(TimeSeriesMerger.merge(Collections.singletonList(existing),
                TestSlices.points("14-Dec-25", "16-Dec-25", 100, 90),
                DateRange.of("14-Dec-25", "16-Dec-25"), null, "", recompute));
        assertEquals(0.42, immature.forecast, 0.0);

        ParameterValue older = TestSlices.windowSlice("1-Nov-25", "13-Dec-25", "");
        older.forecast = 0.42;
        ParameterValue untouched = last(TimeSeriesMerger.merge(Collections.singletonList(older),
                TestSlices.points("14-Dec-25", "16-Dec-25", 100, 90),
                DateRange.of("14-Dec-25", "16-Dec-25"), null, "", WINDOW));
        assertEquals(0.42, untouched.forecast, 0.0);
    }

    @Test
    void totalsBeyondStoredRangeAreRejected() {
        List<TimeSeriesPoint> points = TestSlices.points("1-Dec-25", "2-Dec-25", 2_000_000_000, 10);

        assertThrows(IllegalArgumentException.class, () -> TimeSeriesMerger.merge(new ArrayList<>(), points,
                DateRange.of("1-Dec-25", "2-Dec-25"), null, "", WINDOW));
    }
}
