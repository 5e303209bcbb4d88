package com.dagnet.analytics.policy;

import com.dagnet.analytics.TestSlices;
import com.dagnet.analytics.config.RefetchPolicyConfig;
import com.dagnet.analytics.model.DateRange;
import com.dagnet.analytics.model.LatencyConfig;
import com.dagnet.analytics.model.ParameterValue;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RefetchPolicyTest {

    private static final Instant REFERENCE = Instant.parse("2025-12-17T12:00:00Z");
    private static final DateRange LAST_TWO_WEEKS = DateRange.of("3-Dec-25", "17-Dec-25");

    @Test
    void disabledLatencyDelegatesToGapAnalysis() {
        RefetchDecision decision = RefetchPolicy.shouldRefetch(
                null, LatencyConfig.disabled(), LAST_TWO_WEEKS, false, REFERENCE);
        assertEquals(RefetchDecision.Type.GAPS_ONLY, decision.type);
        assertEquals(RefetchReasons.LATENCY_DISABLED, decision.reason);

        assertEquals(RefetchDecision.Type.GAPS_ONLY,
                RefetchPolicy.shouldRefetch(null, null, LAST_TWO_WEEKS, true, REFERENCE).type);
    }

    @Test
    void windowWithImmatureTailIsPartial() {
        RefetchDecision decision = RefetchPolicy.shouldRefetch(
                null, LatencyConfig.enabled(7.0), LAST_TWO_WEEKS, false, REFERENCE);

        RefetchDecision.Partial partial = assertInstanceOf(RefetchDecision.Partial.class, decision);
        assertEquals(LocalDate.of(2025, 12, 9), partial.matureCutoff);
        assertEquals(DateRange.of("9-Dec-25", "17-Dec-25"), partial.refetchWindow);
        assertEquals(RefetchReasons.IMMATURE_WINDOW, partial.reason);
    }

    @Test
    void missingT95UsesThirtyDayFallback() {
        RefetchDecision decision = RefetchPolicy.shouldRefetch(
                null, LatencyConfig.enabled(0.0), LAST_TWO_WEEKS, false, REFERENCE);

        RefetchDecision.Partial partial = assertInstanceOf(RefetchDecision.Partial.class, decision);
        assertEquals(LocalDate.of(2025, 11, 16), partial.matureCutoff);
        // Cutoff precedes the window, so the whole window is immature.
        assertEquals(LAST_TWO_WEEKS, partial.refetchWindow);
    }

    @Test
    void fullyMatureWindowOnlyFillsGaps() {
        RefetchDecision decision = RefetchPolicy.shouldRefetch(
                null, LatencyConfig.enabled(7.0), DateRange.of("1-Nov-25", "9-Dec-25"), false, REFERENCE);
        assertEquals(RefetchDecision.Type.GAPS_ONLY, decision.type);
        assertEquals(RefetchReasons.WINDOW_FULLY_MATURE, decision.reason);
        assertFalse(decision.isCooldownApplied());

        RefetchDecision oneDayLater = RefetchPolicy.shouldRefetch(
                null, LatencyConfig.enabled(7.0), DateRange.of("1-Nov-25", "10-Dec-25"), false, REFERENCE);
        RefetchDecision.Partial partial = assertInstanceOf(RefetchDecision.Partial.class, oneDayLater);
        assertEquals(DateRange.of("9-Dec-25", "10-Dec-25"), partial.refetchWindow);
    }

    @Test
    void recentWindowFetchSuppressesImmatureRefetch() {
        ParameterValue slice = TestSlices.retrievedAt(
                TestSlices.windowSlice("3-Dec-25", "17-Dec-25", ""), "2025-12-17T06:00:00Z");

        RefetchDecision decision = RefetchPolicy.shouldRefetch(
                slice, LatencyConfig.enabled(7.0), LAST_TWO_WEEKS, false, REFERENCE);

        RefetchDecision.GapsOnly gapsOnly = assertInstanceOf(RefetchDecision.GapsOnly.class, decision);
        assertEquals(RefetchReasons.RECENT_FETCH_COOLDOWN, gapsOnly.reason);
        assertTrue(gapsOnly.isCooldownApplied());
        assertEquals(720, gapsOnly.cooldown.cooldownMinutes);
        assertEquals("2025-12-17T06:00:00Z", gapsOnly.cooldown.lastRetrievedAt);
        assertEquals(360.0, gapsOnly.cooldown.lastRetrievedAgeMinutes, 1e-9);
        assertEquals(DateRange.of("9-Dec-25", "17-Dec-25"), gapsOnly.wouldRefetchWindow);
        assertNull(gapsOnly.hasImmatureCohorts);
    }

    @Test
    void cooldownIgnoresOldFutureAndUnparseableRetrievals() {
        LatencyConfig latency = LatencyConfig.enabled(7.0);
        ParameterValue old = TestSlices.retrievedAt(
                TestSlices.windowSlice("3-Dec-25", "17-Dec-25", ""), "2025-12-16T23:00:00Z");
        ParameterValue future = TestSlices.retrievedAt(
                TestSlices.windowSlice("3-Dec-25", "17-Dec-25", ""), "2025-12-17T13:00:00Z");
        ParameterValue garbled = TestSlices.retrievedAt(
                TestSlices.windowSlice("3-Dec-25", "17-Dec-25", ""), "sometime today");

        assertEquals(RefetchDecision.Type.PARTIAL,
                RefetchPolicy.shouldRefetch(old, latency, LAST_TWO_WEEKS, false, REFERENCE).type);
        assertEquals(RefetchDecision.Type.PARTIAL,
                RefetchPolicy.shouldRefetch(future, latency, LAST_TWO_WEEKS, false, REFERENCE).type);
        assertEquals(RefetchDecision.Type.PARTIAL,
                RefetchPolicy.shouldRefetch(garbled, latency, LAST_TWO_WEEKS, false, REFERENCE).type);
    }

    @Test
    void cooldownLengthComesFromConfiguration() {
        ParameterValue slice = TestSlices.retrievedAt(
                TestSlices.windowSlice("3-Dec-25", "17-Dec-25", ""), "2025-12-17T06:00:00Z");
        RefetchPolicyConfig noCooldown = RefetchPolicyConfig.defaults().withCooldownMinutes(0);

        RefetchDecision decision = RefetchPolicy.shouldRefetch(
                slice, LatencyConfig.enabled(7.0), LAST_TWO_WEEKS, false, REFERENCE, noCooldown);
        assertEquals(RefetchDecision.Type.PARTIAL, decision.type);
    }

    @Test
    void cohortWithoutSliceOrDatesIsReplaced() {
        LatencyConfig latency = LatencyConfig.enabled(7.0);
        RefetchDecision missing = RefetchPolicy.shouldRefetch(null, latency, LAST_TWO_WEEKS, true, REFERENCE);
        RefetchDecision.ReplaceSlice replace = assertInstanceOf(RefetchDecision.ReplaceSlice.class, missing);
        assertEquals(RefetchReasons.NO_EXISTING_SLICE, replace.reason);
        assertTrue(replace.hasImmatureCohorts);

        ParameterValue empty = new ParameterValue();
        empty.dates = new ArrayList<>();
        RefetchDecision noDates = RefetchPolicy.shouldRefetch(empty, latency, LAST_TWO_WEEKS, true, REFERENCE);
        assertEquals(RefetchReasons.NO_COHORT_DATES, noDates.reason);
    }

    @Test
    void cohortWithImmatureDateIsReplaced() {
        ParameterValue slice = TestSlices.retrievedAt(
                TestSlices.cohortSlice("landing", "1-Nov-25", "12-Dec-25", ""), "2025-12-16T20:00:00Z");

        RefetchDecision decision = RefetchPolicy.shouldRefetch(
                slice, LatencyConfig.enabled(7.0), LAST_TWO_WEEKS, true, REFERENCE);

        RefetchDecision.ReplaceSlice replace = assertInstanceOf(RefetchDecision.ReplaceSlice.class, decision);
        assertEquals(RefetchReasons.IMMATURE_COHORTS, replace.reason);
        assertTrue(replace.hasImmatureCohorts);
        assertEquals(LocalDate.of(2025, 12, 10), replace.matureCutoff);
    }

    @Test
    void cohortWithImmatureDateInsideCooldownOnlyFillsGaps() {
        ParameterValue slice = TestSlices.retrievedAt(
                TestSlices.cohortSlice("landing", "1-Nov-25", "12-Dec-25", ""), "2025-12-17T10:00:00Z");

        RefetchDecision decision = RefetchPolicy.shouldRefetch(
                slice, LatencyConfig.enabled(7.0), LAST_TWO_WEEKS, true, REFERENCE);

        RefetchDecision.GapsOnly gapsOnly = assertInstanceOf(RefetchDecision.GapsOnly.class, decision);
        assertEquals(RefetchReasons.RECENT_FETCH_COOLDOWN, gapsOnly.reason);
        assertEquals(Boolean.TRUE, gapsOnly.hasImmatureCohorts);
        assertEquals(120.0, gapsOnly.cooldown.lastRetrievedAgeMinutes, 1e-9);
    }

    @Test
    void cohortPathT95DrivesMaturity() {
        ParameterValue slice = TestSlices.retrievedAt(
                TestSlices.cohortSlice("landing", "1-Nov-25", "8-Dec-25", ""), "2025-12-16T20:00:00Z");

        RefetchDecision withPath = RefetchPolicy.shouldRefetch(
                slice, LatencyConfig.enabled(2.0, 10.0, "landing"), LAST_TWO_WEEKS, true, REFERENCE);
        assertEquals(RefetchReasons.IMMATURE_COHORTS, withPath.reason);

        RefetchDecision localOnly = RefetchPolicy.shouldRefetch(
                slice, LatencyConfig.enabled(2.0), LAST_TWO_WEEKS, true, REFERENCE);
        assertEquals(RefetchDecision.Type.USE_CACHE, localOnly.type);
    }

    @Test
    void matureCohortsAreStaleOnceRetrievalPredatesHorizon() {
        LatencyConfig latency = LatencyConfig.enabled(7.0);
        ParameterValue stale = TestSlices.retrievedAt(
                TestSlices.cohortSlice("landing", "1-Nov-25", "10-Dec-25", ""), "2025-12-01T00:00:00Z");
        ParameterValue fresh = TestSlices.retrievedAt(
                TestSlices.cohortSlice("landing", "1-Nov-25", "10-Dec-25", ""), "2025-12-15T00:00:00Z");

        RefetchDecision staleDecision = RefetchPolicy.shouldRefetch(stale, latency, LAST_TWO_WEEKS, true, REFERENCE);
        RefetchDecision.ReplaceSlice replace = assertInstanceOf(RefetchDecision.ReplaceSlice.class, staleDecision);
        assertEquals(RefetchReasons.STALE_DATA, replace.reason);
        assertFalse(replace.hasImmatureCohorts);

        RefetchDecision freshDecision = RefetchPolicy.shouldRefetch(fresh, latency, LAST_TWO_WEEKS, true, REFERENCE);
        assertEquals(RefetchDecision.Type.USE_CACHE, freshDecision.type);
        assertEquals(RefetchReasons.COHORTS_MATURE_AND_FRESH, freshDecision.reason);
    }

    @Test
    void visitorDispatchesOnVariant() {
        RefetchDecision.Visitor<String> names = new RefetchDecision.Visitor<String>() {
            @Override
            public String gapsOnly(RefetchDecision.GapsOnly decision) {
                return "gaps";
            }

            @Override
            public String partial(RefetchDecision.Partial decision) {
                return "partial:" + decision.refetchWindow;
            }

            @Override
            public String replaceSlice(RefetchDecision.ReplaceSlice decision) {
                return "replace:" + decision.reason;
            }

            @Override
            public String useCache(RefetchDecision.UseCache decision) {
                return "cache";
            }
        };

        assertEquals("partial:9-Dec-25:17-Dec-25", RefetchPolicy.shouldRefetch(
                null, LatencyConfig.enabled(7.0), LAST_TWO_WEEKS, false, REFERENCE).accept(names));
        assertEquals("replace:no_existing_slice", RefetchPolicy.shouldRefetch(
                null, LatencyConfig.enabled(7.0), LAST_TWO_WEEKS, true, REFERENCE).accept(names));
        assertEquals("cache", RefetchDecision.useCache().accept(names));
    }

    @Test
    void missingRequestedWindowIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> RefetchPolicy.shouldRefetch(null, LatencyConfig.enabled(7.0), null, false, REFERENCE));
    }
}
