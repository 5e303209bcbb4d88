package com.dagnet.analytics.maturity;

import com.dagnet.analytics.config.RefetchPolicyConfig;
import com.dagnet.analytics.model.LatencyConfig;

/**
 * Maps a latency configuration to the number of days after which a day's conversions are
 * treated as settled.
 */
public final class MaturityModel {
    private MaturityModel() {}

    public static int effectiveMaturity(LatencyConfig latencyConfig, boolean isCohortQuery) {
        return effectiveMaturity(latencyConfig, isCohortQuery, RefetchPolicyConfig.defaults());
    }

    /**
     * Window queries use {@code ceil(t95)}; cohort queries prefer {@code ceil(path_t95)} and fall
     * back to {@code ceil(t95)}. A missing or non-positive value yields the configured default.
     */
    public static int effectiveMaturity(LatencyConfig latencyConfig, boolean isCohortQuery, RefetchPolicyConfig config) {
        if (latencyConfig == null) {
            return config.defaultT95Days;
        }
        if (isCohortQuery && isPositive(latencyConfig.pathT95)) {
            return (int) Math.ceil(latencyConfig.pathT95);
        }
        if (isPositive(latencyConfig.t95)) {
            return (int) Math.ceil(latencyConfig.t95);
        }
        return config.defaultT95Days;
    }

    private static boolean isPositive(Double value) {
        return value != null && !value.isNaN() && value > 0.0;
    }
}
