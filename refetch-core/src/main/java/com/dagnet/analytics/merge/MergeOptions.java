package com.dagnet.analytics.merge;

import com.dagnet.analytics.model.LatencyConfig;
import com.dagnet.analytics.model.ParameterValue;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-merge settings. {@code referenceDate} stands in for "now": it is written as
 * {@code data_source.retrieved_at} and anchors forecast ages, so a merge is a pure function
 * of its inputs.
 */
public final class MergeOptions {
    public static final String DEFAULT_DATA_SOURCE_TYPE = "api";

    public final boolean cohortMode;
    public final LatencyConfig latencyConfig;
    public final ParameterValue.LatencySummary latencySummary;
    public final boolean recomputeForecast;
    public final String dataSourceType;
    public final String fullQuery;
    public final Instant referenceDate;

    private MergeOptions(Builder builder) {
        this.cohortMode = builder.cohortMode;
        this.latencyConfig = builder.latencyConfig;
        this.latencySummary = builder.latencySummary;
        this.recomputeForecast = builder.recomputeForecast;
        this.dataSourceType = builder.dataSourceType == null ? DEFAULT_DATA_SOURCE_TYPE : builder.dataSourceType;
        this.fullQuery = builder.fullQuery;
        this.referenceDate = Objects.requireNonNull(builder.referenceDate, "referenceDate");
    }

    public static Builder window(Instant referenceDate) {
        return new Builder(false, referenceDate);
    }

    public static Builder cohort(Instant referenceDate) {
        return new Builder(true, referenceDate);
    }

    public static final class Builder {
        private final boolean cohortMode;
        private final Instant referenceDate;
        private LatencyConfig latencyConfig;
        private ParameterValue.LatencySummary latencySummary;
        private boolean recomputeForecast;
        private String dataSourceType;
        private String fullQuery;

        private Builder(boolean cohortMode, Instant referenceDate) {
            this.cohortMode = cohortMode;
            this.referenceDate = referenceDate;
        }

        public Builder latencyConfig(LatencyConfig latencyConfig) {
            this.latencyConfig = latencyConfig;
            return this;
        }

        public Builder latencySummary(ParameterValue.LatencySummary latencySummary) {
            this.latencySummary = latencySummary;
            return this;
        }

        public Builder recomputeForecast(boolean recomputeForecast) {
            this.recomputeForecast = recomputeForecast;
            return this;
        }

        public Builder dataSourceType(String dataSourceType) {
            this.dataSourceType = dataSourceType;
            return this;
        }

        public Builder fullQuery(String fullQuery) {
            this.fullQuery = fullQuery;
            return this;
        }

        public MergeOptions build() {
            return new MergeOptions(this);
        }
    }
}
