package com.dagnet.analytics.model;

import com.dagnet.analytics.util.CalendarDates;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive day-granularity date range.
 */
public final class DateRange implements Serializable {
    private static final long serialVersionUID = 1L;

    private final LocalDate start;
    private final LocalDate end;

    private DateRange(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date range bounds must not be null");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Date range start " + start + " is after end " + end);
        }
        this.start = start;
        this.end = end;
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    /**
     * Parses both bounds in any accepted calendar format.
     */
    public static DateRange of(String start, String end) {
        return new DateRange(CalendarDates.parse(start), CalendarDates.parse(end));
    }

    public static DateRange singleDay(LocalDate day) {
        return new DateRange(day, day);
    }

    public LocalDate start() {
        return start;
    }

    public LocalDate end() {
        return end;
    }

    public String startText() {
        return CalendarDates.format(start);
    }

    public String endText() {
        return CalendarDates.format(end);
    }

    public boolean contains(LocalDate day) {
        return !day.isBefore(start) && !day.isAfter(end);
    }

    public boolean containsRange(DateRange other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public boolean overlaps(DateRange other) {
        return !start.isAfter(other.end) && !other.start.isAfter(end);
    }

    public int dayCount() {
        return (int) CalendarDates.daysBetween(start, end) + 1;
    }

    public List<LocalDate> days() {
        return CalendarDates.eachDay(start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DateRange)) {
            return false;
        }
        DateRange other = (DateRange) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return startText() + ":" + endText();
    }
}
