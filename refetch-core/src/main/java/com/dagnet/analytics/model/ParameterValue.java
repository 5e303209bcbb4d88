package com.dagnet.analytics.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * One stored slice of a parameter: a single slice family (mode + context dimensions) with its
 * daily observations, aggregate totals and provenance.
 *
 * <p>Invariants after every merge:
 * - {@code dates}, {@code nDaily}, {@code kDaily} are parallel, chronologically sorted, no duplicate dates.
 * - {@code n = sum(nDaily)}, {@code k = sum(kDaily)}, {@code mean = round(k / n, 3)}.
 * - exactly one of window_from/window_to or cohort_from/cohort_to is set, equal to the array endpoints.
 * - {@code sliceDsl} is regenerated from the date range and context dimensions.
 * </p>
 */
public class ParameterValue implements Serializable {
    private static final long serialVersionUID = 1L;

    public Double mean;
    public Integer n;
    public Integer k;
    public Double stdev;

    public List<String> dates;
    public List<Integer> nDaily;
    public List<Integer> kDaily;

    public String windowFrom;
    public String windowTo;
    public String cohortFrom;
    public String cohortTo;

    public String sliceDsl;
    public String querySignature;

    // Window mode only: maturity-excluded, recency-weighted baseline probability.
    public Double forecast;

    // Cohort mode only: per-day lag arrays aligned with dates.
    public List<Double> medianLagDays;
    public List<Double> meanLagDays;
    public List<Double> anchorMedianLagDays;
    public List<Double> anchorMeanLagDays;

    public LatencySummary latency;
    public DataSource dataSource;

    public ParameterValue() {}

    public boolean isCohortMode() {
        if (cohortFrom != null || cohortTo != null) {
            return true;
        }
        return sliceDsl != null && sliceDsl.contains("cohort(");
    }

    public int dateCount() {
        return dates == null ? 0 : dates.size();
    }

    public boolean hasAggregate() {
        return mean != null && n != null;
    }

    public String retrievedAt() {
        return dataSource == null ? null : dataSource.retrievedAt;
    }

    /**
     * Header date range: cohort_from/cohort_to for cohort slices, window_from/window_to otherwise.
     * Null when the relevant header fields are not both present.
     */
    public String[] headerRange() {
        String from = isCohortMode() ? cohortFrom : windowFrom;
        String to = isCohortMode() ? cohortTo : windowTo;
        if (from == null || to == null) {
            return null;
        }
        return new String[] {from, to};
    }

    public ParameterValue copy() {
        ParameterValue c = new ParameterValue();
        c.mean = mean;
        c.n = n;
        c.k = k;
        c.stdev = stdev;
        c.dates = copyOf(dates);
        c.nDaily = copyOf(nDaily);
        c.kDaily = copyOf(kDaily);
        c.windowFrom = windowFrom;
        c.windowTo = windowTo;
        c.cohortFrom = cohortFrom;
        c.cohortTo = cohortTo;
        c.sliceDsl = sliceDsl;
        c.querySignature = querySignature;
        c.forecast = forecast;
        c.medianLagDays = copyOf(medianLagDays);
        c.meanLagDays = copyOf(meanLagDays);
        c.anchorMedianLagDays = copyOf(anchorMedianLagDays);
        c.anchorMeanLagDays = copyOf(anchorMeanLagDays);
        c.latency = latency == null ? null : latency.copy();
        c.dataSource = dataSource == null ? null : dataSource.copy();
        return c;
    }

    private static <T> List<T> copyOf(List<T> values) {
        return values == null ? null : new ArrayList<>(values);
    }

    public static class DataSource implements Serializable {
        private static final long serialVersionUID = 1L;

        public String type;
        public String retrievedAt;
        public String fullQuery;

        public DataSource() {}

        public DataSource(String type, String retrievedAt) {
            this.type = type;
            this.retrievedAt = retrievedAt;
        }

        public DataSource copy() {
            DataSource c = new DataSource(type, retrievedAt);
            c.fullQuery = fullQuery;
            return c;
        }
    }

    public static class LatencySummary implements Serializable {
        private static final long serialVersionUID = 1L;

        public Double medianLagDays;
        public Double meanLagDays;

        public LatencySummary() {}

        public LatencySummary(Double medianLagDays, Double meanLagDays) {
            this.medianLagDays = medianLagDays;
            this.meanLagDays = meanLagDays;
        }

        public LatencySummary copy() {
            return new LatencySummary(medianLagDays, meanLagDays);
        }
    }
}
