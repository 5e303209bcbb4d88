package com.dagnet.analytics.coverage;

import com.dagnet.analytics.model.DateRange;
import com.dagnet.analytics.model.ParameterValue;
import com.dagnet.analytics.policy.RefetchDecision;
import com.dagnet.analytics.util.CalendarDates;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies requested days against a cached slice and turns a refetch decision into the
 * concrete window to fetch.
 */
public final class SliceCoverageAnalyzer {
    private SliceCoverageAnalyzer() {}

    /**
     * Days after {@code matureCutoff} are immature; days on or before it are covered or missing.
     * A null cutoff treats every day as mature. Without a slice every mature day is missing.
     */
    public static SliceCoverage analyzeSliceCoverage(ParameterValue slice, DateRange requestedWindow, LocalDate matureCutoff) {
        if (requestedWindow == null) {
            throw new IllegalArgumentException("requestedWindow is required");
        }
        Set<LocalDate> cached = new HashSet<>();
        if (slice != null && slice.dates != null) {
            for (String date : slice.dates) {
                cached.add(CalendarDates.parse(date));
            }
        }

        List<LocalDate> immature = new ArrayList<>();
        List<LocalDate> missingMature = new ArrayList<>();
        int matureDays = 0;
        for (LocalDate day : requestedWindow.days()) {
            if (matureCutoff != null && day.isAfter(matureCutoff)) {
                immature.add(day);
                continue;
            }
            matureDays++;
            if (!cached.contains(day)) {
                missingMature.add(day);
            }
        }

        SliceCoverage.MatureCoverage matureCoverage;
        if (matureDays == 0 || missingMature.isEmpty()) {
            matureCoverage = SliceCoverage.MatureCoverage.FULL;
        } else if (missingMature.size() >= matureDays) {
            matureCoverage = SliceCoverage.MatureCoverage.NONE;
        } else {
            matureCoverage = SliceCoverage.MatureCoverage.PARTIAL;
        }
        return new SliceCoverage(matureCoverage, immature, missingMature);
    }

    /**
     * Window to fetch for a decision, or null when nothing needs fetching.
     */
    public static DateRange computeFetchWindow(RefetchDecision decision, SliceCoverage coverage, DateRange requestedWindow) {
        return decision.accept(new RefetchDecision.Visitor<DateRange>() {
            @Override
            public DateRange gapsOnly(RefetchDecision.GapsOnly gapsOnly) {
                List<LocalDate> missing = new ArrayList<>(coverage.missingMatureDates);
                // Cooldown suppresses maturity-driven refetch, not genuine cache misses.
                if (!gapsOnly.isCooldownApplied()) {
                    missing.addAll(coverage.immatureDates);
                }
                return DateGaps.span(missing);
            }

            @Override
            public DateRange partial(RefetchDecision.Partial partial) {
                DateRange refetch = partial.refetchWindow;
                DateRange matureGaps = DateGaps.span(coverage.missingMatureDates);
                if (matureGaps != null && matureGaps.start().isBefore(refetch.start())) {
                    return DateRange.of(matureGaps.start(), refetch.end());
                }
                return refetch;
            }

            @Override
            public DateRange replaceSlice(RefetchDecision.ReplaceSlice replaceSlice) {
                return requestedWindow;
            }

            @Override
            public DateRange useCache(RefetchDecision.UseCache useCache) {
                return null;
            }
        });
    }
}
