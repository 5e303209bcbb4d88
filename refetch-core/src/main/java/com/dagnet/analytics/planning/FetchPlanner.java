package com.dagnet.analytics.planning;

import com.dagnet.analytics.config.RefetchPolicyConfig;
import com.dagnet.analytics.coverage.SliceCoverage;
import com.dagnet.analytics.coverage.SliceCoverageAnalyzer;
import com.dagnet.analytics.model.DateRange;
import com.dagnet.analytics.model.LatencyConfig;
import com.dagnet.analytics.model.ParameterValue;
import com.dagnet.analytics.policy.RefetchDecision;
import com.dagnet.analytics.policy.RefetchPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Runs policy, coverage and fetch-window computation for a single cached slice.
 */
public final class FetchPlanner {
    private static final Logger LOG = LoggerFactory.getLogger(FetchPlanner.class);

    private FetchPlanner() {}

    public static FetchPlan plan(
            ParameterValue existingSlice,
            LatencyConfig latencyConfig,
            DateRange requestedWindow,
            boolean isCohortQuery,
            Instant referenceDate) {
        return plan(existingSlice, latencyConfig, requestedWindow, isCohortQuery, referenceDate,
                RefetchPolicyConfig.defaults());
    }

    public static FetchPlan plan(
            ParameterValue existingSlice,
            LatencyConfig latencyConfig,
            DateRange requestedWindow,
            boolean isCohortQuery,
            Instant referenceDate,
            RefetchPolicyConfig config) {
        RefetchDecision decision = RefetchPolicy.shouldRefetch(
                existingSlice, latencyConfig, requestedWindow, isCohortQuery, referenceDate, config);
        SliceCoverage coverage = SliceCoverageAnalyzer.analyzeSliceCoverage(
                existingSlice, requestedWindow, decision.matureCutoff());
        DateRange fetchWindow = SliceCoverageAnalyzer.computeFetchWindow(decision, coverage, requestedWindow);
        FetchPlan plan = new FetchPlan(decision, coverage, fetchWindow);
        LOG.debug("Fetch plan for {}: {}", requestedWindow, plan);
        return plan;
    }
}
