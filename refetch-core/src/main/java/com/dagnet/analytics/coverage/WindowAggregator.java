package com.dagnet.analytics.coverage;

import com.dagnet.analytics.model.DateRange;
import com.dagnet.analytics.model.ParameterValue;
import com.dagnet.analytics.model.TimeSeriesPoint;
import com.dagnet.analytics.slice.SliceDays;
import com.dagnet.analytics.util.CalendarDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pools daily counts over a window.
 */
public final class WindowAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(WindowAggregator.class);

    private WindowAggregator() {}

    public static WindowAggregation aggregate(ParameterValue slice, DateRange window) {
        return aggregate(SliceDays.points(slice), window);
    }

    public static WindowAggregation aggregate(List<TimeSeriesPoint> points, DateRange window) {
        if (window == null) {
            throw new IllegalArgumentException("window is required");
        }
        List<TimeSeriesPoint> included = new ArrayList<>();
        Set<LocalDate> available = new HashSet<>();
        long n = 0L;
        long k = 0L;
        for (TimeSeriesPoint point : points) {
            LocalDate day = CalendarDates.parse(point.date);
            if (!window.contains(day)) {
                continue;
            }
            if (point.k > point.n) {
                LOG.warn("Inconsistent daily counts on {}: k={} exceeds n={}", point.date, point.k, point.n);
            }
            included.add(point);
            available.add(day);
            n += point.n;
            k += point.k;
        }
        if (included.isEmpty()) {
            throw new IllegalArgumentException("No data available for window " + window);
        }

        List<LocalDate> missing = DateGaps.missingDays(window, available);
        double mean = n > 0 ? (double) k / n : 0.0;
        return new WindowAggregation(window, n, k, mean, binomialStdev(n, k), included, missing,
                DateGaps.contiguousRanges(missing));
    }

    static double binomialStdev(long n, long k) {
        if (n == 0) {
            return 0.0;
        }
        double p = (double) k / n;
        if (p <= 0.0 || p >= 1.0) {
            return 0.0;
        }
        return Math.sqrt(p * (1.0 - p) / n);
    }
}
