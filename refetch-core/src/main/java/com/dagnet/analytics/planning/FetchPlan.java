package com.dagnet.analytics.planning;

import com.dagnet.analytics.coverage.SliceCoverage;
import com.dagnet.analytics.model.DateRange;
import com.dagnet.analytics.policy.RefetchDecision;

/**
 * Policy decision, coverage analysis and the resulting fetch window for one request.
 */
public final class FetchPlan {
    public final RefetchDecision decision;
    public final SliceCoverage coverage;
    // Null when the cache already answers the request.
    public final DateRange fetchWindow;

    FetchPlan(RefetchDecision decision, SliceCoverage coverage, DateRange fetchWindow) {
        this.decision = decision;
        this.coverage = coverage;
        this.fetchWindow = fetchWindow;
    }

    public boolean needsFetch() {
        return fetchWindow != null;
    }

    @Override
    public String toString() {
        return "FetchPlan{decision=" + decision + ", coverage=" + coverage + ", fetchWindow=" + fetchWindow + "}";
    }
}
