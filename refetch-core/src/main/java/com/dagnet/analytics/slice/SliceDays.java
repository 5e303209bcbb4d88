package com.dagnet.analytics.slice;

import com.dagnet.analytics.model.ParameterValue;
import com.dagnet.analytics.model.TimeSeriesPoint;
import com.dagnet.analytics.util.CalendarDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the parallel {@code dates / n_daily / k_daily} arrays of a stored slice.
 */
public final class SliceDays {
    private static final Logger LOG = LoggerFactory.getLogger(SliceDays.class);

    private SliceDays() {}

    /**
     * Days that carry a usable count: {@code n_daily[i]} or {@code k_daily[i]} is present.
     * Days past the end of a shorter daily array count as absent.
     */
    public static Set<LocalDate> daysWithData(ParameterValue value) {
        Set<LocalDate> days = new LinkedHashSet<>();
        if (value == null || value.dates == null) {
            return days;
        }
        warnOnLengthMismatch(value);
        for (int i = 0; i < value.dates.size(); i++) {
            if (valueAt(value.nDaily, i) != null || valueAt(value.kDaily, i) != null) {
                days.add(CalendarDates.parse(value.dates.get(i)));
            }
        }
        return days;
    }

    /**
     * Daily points in array order. Fails when the arrays disagree in length; aggregation
     * over misaligned arrays would attribute counts to the wrong day.
     */
    public static List<TimeSeriesPoint> points(ParameterValue value) {
        List<TimeSeriesPoint> points = new ArrayList<>();
        if (value == null || value.dates == null || value.nDaily == null || value.kDaily == null) {
            return points;
        }
        int size = value.dates.size();
        if (value.nDaily.size() != size || value.kDaily.size() != size) {
            throw new IllegalArgumentException("n_daily, k_daily and dates arrays must have the same length for slice "
                    + value.sliceDsl);
        }
        for (int i = 0; i < size; i++) {
            Integer n = value.nDaily.get(i);
            Integer k = value.kDaily.get(i);
            if (n == null && k == null) {
                continue;
            }
            points.add(new TimeSeriesPoint(
                    CalendarDates.normalize(value.dates.get(i)),
                    n == null ? 0 : n,
                    k == null ? 0 : k));
        }
        return points;
    }

    public static <T> T valueAt(List<T> values, int index) {
        if (values == null || index >= values.size()) {
            return null;
        }
        return values.get(index);
    }

    static void warnOnLengthMismatch(ParameterValue value) {
        int dates = value.dateCount();
        int nDaily = value.nDaily == null ? 0 : value.nDaily.size();
        int kDaily = value.kDaily == null ? 0 : value.kDaily.size();
        if (nDaily != dates || kDaily != dates) {
            LOG.warn("Slice {} has mismatched daily arrays: dates={} n_daily={} k_daily={}",
                    value.sliceDsl, dates, nDaily, kDaily);
        }
    }
}
