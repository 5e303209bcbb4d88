package com.dagnet.analytics.model;

import java.io.Serializable;

/**
 * Edge latency settings that drive maturity. {@code t95} is the local 95th-percentile lag,
 * {@code pathT95} the cumulative lag from the cohort anchor.
 */
public class LatencyConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    public boolean latencyParameter;
    public Double t95;
    public Double pathT95;
    public String anchorNodeId;

    public LatencyConfig() {}

    public static LatencyConfig disabled() {
        return new LatencyConfig();
    }

    public static LatencyConfig enabled(Double t95) {
        LatencyConfig config = new LatencyConfig();
        config.latencyParameter = true;
        config.t95 = t95;
        return config;
    }

    public static LatencyConfig enabled(Double t95, Double pathT95, String anchorNodeId) {
        LatencyConfig config = enabled(t95);
        config.pathT95 = pathT95;
        config.anchorNodeId = anchorNodeId;
        return config;
    }

    public static boolean isEnabled(LatencyConfig config) {
        return config != null && config.latencyParameter;
    }
}
