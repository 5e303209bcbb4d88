package com.dagnet.analytics.policy;

/**
 * Reason codes attached to refetch decisions. Stable strings; they surface in logs and diagnostics.
 */
public final class RefetchReasons {
    private RefetchReasons() {}

    public static final String LATENCY_DISABLED = "latency_disabled";
    public static final String WINDOW_FULLY_MATURE = "window_fully_mature";
    public static final String IMMATURE_WINDOW = "immature_window";
    public static final String RECENT_FETCH_COOLDOWN = "recent_fetch_cooldown";
    public static final String NO_EXISTING_SLICE = "no_existing_slice";
    public static final String NO_COHORT_DATES = "no_cohort_dates";
    public static final String IMMATURE_COHORTS = "immature_cohorts";
    public static final String STALE_DATA = "stale_data";
    public static final String COHORTS_MATURE_AND_FRESH = "cohorts_mature_and_fresh";
}
