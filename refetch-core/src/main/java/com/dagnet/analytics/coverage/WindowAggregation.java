package com.dagnet.analytics.coverage;

import com.dagnet.analytics.model.DateRange;
import com.dagnet.analytics.model.TimeSeriesPoint;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * Naive pooled totals of the daily points inside a window, with the shape of the days that
 * had no data.
 */
public final class WindowAggregation {
    public final DateRange window;
    public final long n;
    public final long k;
    // Unrounded k/n; 0 when n is 0.
    public final double mean;
    public final double stdev;
    public final List<TimeSeriesPoint> points;
    public final int daysIncluded;
    public final int daysMissing;
    public final List<LocalDate> missingDates;
    public final List<DateRange> gaps;
    public final boolean missingAtStart;
    public final boolean missingAtEnd;
    public final boolean hasMiddleGaps;

    WindowAggregation(
            DateRange window,
            long n,
            long k,
            double mean,
            double stdev,
            List<TimeSeriesPoint> points,
            List<LocalDate> missingDates,
            List<DateRange> gaps) {
        this.window = window;
        this.n = n;
        this.k = k;
        this.mean = mean;
        this.stdev = stdev;
        this.points = Collections.unmodifiableList(points);
        this.daysIncluded = points.size();
        this.daysMissing = missingDates.size();
        this.missingDates = Collections.unmodifiableList(missingDates);
        this.gaps = Collections.unmodifiableList(gaps);
        this.missingAtStart = !missingDates.isEmpty() && missingDates.get(0).equals(window.start());
        this.missingAtEnd = !missingDates.isEmpty() && missingDates.get(missingDates.size() - 1).equals(window.end());
        boolean middle = false;
        for (DateRange gap : gaps) {
            if (!gap.start().equals(window.start()) && !gap.end().equals(window.end())) {
                middle = true;
                break;
            }
        }
        this.hasMiddleGaps = middle;
    }
}
