package com.dagnet.analytics.model;

import java.io.Serializable;

/**
 * One freshly fetched daily observation. Lag fields are only populated for cohort queries.
 */
public class TimeSeriesPoint implements Serializable {
    private static final long serialVersionUID = 1L;

    public String date;
    public int n;
    public int k;

    public Double medianLagDays;
    public Double meanLagDays;
    public Double anchorMedianLagDays;
    public Double anchorMeanLagDays;

    public TimeSeriesPoint() {}

    public TimeSeriesPoint(String date, int n, int k) {
        this.date = date;
        this.n = n;
        this.k = k;
    }

    public double p() {
        return n > 0 ? (double) k / n : 0.0;
    }

    public TimeSeriesPoint withLag(Double medianLagDays, Double meanLagDays) {
        this.medianLagDays = medianLagDays;
        this.meanLagDays = meanLagDays;
        return this;
    }

    public TimeSeriesPoint withAnchorLag(Double anchorMedianLagDays, Double anchorMeanLagDays) {
        this.anchorMedianLagDays = anchorMedianLagDays;
        this.anchorMeanLagDays = anchorMeanLagDays;
        return this;
    }

    public boolean hasLag() {
        return medianLagDays != null || meanLagDays != null;
    }

    public boolean hasAnchorLag() {
        return anchorMedianLagDays != null || anchorMeanLagDays != null;
    }
}
