package com.dagnet.analytics.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Day-granularity calendar date handling for slice dates and windows.
 *
 * <p>Canonical text is {@code d-MMM-yy} (for example {@code 1-Dec-25}). Input may also be
 * {@code yyyy-MM-dd} or an ISO date-time; any time suffix is stripped before the format is
 * disambiguated, so {@code 1-Dec-25T00:00:00Z} is a valid canonical date.
 *
 * <p>All arithmetic runs on {@link LocalDate} with UTC as the only zone, so iterating long
 * ranges never drifts across DST boundaries.
 */
public final class CalendarDates {
    private static final Pattern CANONICAL_PATTERN = Pattern.compile("^\\d{1,2}-[A-Za-z]{3}-\\d{2}$");
    private static final Pattern ISO_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    // "T" followed by a digit; month names such as OCT must survive.
    private static final Pattern TIME_SUFFIX = Pattern.compile("T\\d.*$");

    private static final DateTimeFormatter CANONICAL_PARSER = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d-MMM-")
            .appendValueReduced(ChronoField.YEAR, 2, 2, 2000)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter CANONICAL_FORMATTER =
            DateTimeFormatter.ofPattern("d-MMM-yy", Locale.ENGLISH);

    public static final Comparator<String> CHRONOLOGICAL = Comparator.comparing(CalendarDates::parse);

    private CalendarDates() {}

    public static int compareChronologically(String left, String right) {
        return parse(left).compareTo(parse(right));
    }

    public static LocalDate parse(String text) {
        if (text == null) {
            throw new DateParseException("null");
        }
        String datePart = datePart(text);
        try {
            if (CANONICAL_PATTERN.matcher(datePart).matches()) {
                return LocalDate.parse(datePart, CANONICAL_PARSER);
            }
            if (ISO_PATTERN.matcher(datePart).matches()) {
                return LocalDate.parse(datePart, DateTimeFormatter.ISO_LOCAL_DATE);
            }
        } catch (DateTimeParseException ex) {
            throw new DateParseException(text, ex);
        }
        throw new DateParseException(text);
    }

    /**
     * True when the text has the shape of an accepted calendar date (time suffix ignored).
     * Shape only: {@link #parse} may still reject an impossible day such as 31-Feb-25.
     */
    public static boolean looksLikeDate(String text) {
        if (text == null) {
            return false;
        }
        String datePart = datePart(text);
        return CANONICAL_PATTERN.matcher(datePart).matches() || ISO_PATTERN.matcher(datePart).matches();
    }

    private static String datePart(String text) {
        return TIME_SUFFIX.matcher(text.trim()).replaceFirst("");
    }

    public static boolean isCanonical(String text) {
        return text != null && CANONICAL_PATTERN.matcher(text.trim()).matches();
    }

    public static String normalize(String text) {
        return format(parse(text));
    }

    public static String format(LocalDate date) {
        return CANONICAL_FORMATTER.format(date);
    }

    public static String toIso(LocalDate date) {
        return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
    }

    public static Instant startOfDay(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public static LocalDate utcDate(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    public static long daysBetween(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to);
    }

    /**
     * Every day from {@code from} to {@code to}, both inclusive. Empty when {@code from} is after {@code to}.
     */
    public static List<LocalDate> eachDay(LocalDate from, LocalDate to) {
        List<LocalDate> days = new ArrayList<>();
        LocalDate cursor = from;
        while (!cursor.isAfter(to)) {
            days.add(cursor);
            cursor = cursor.plusDays(1);
        }
        return days;
    }

    /**
     * Best-effort parse of provenance timestamps such as {@code data_source.retrieved_at}.
     * Returns null for blank or unrecognised text; callers decide how loud to be about it.
     */
    public static Instant parseTimestamp(String text) {
        if (StringSemantics.isBlank(text)) {
            return null;
        }
        String trimmed = text.trim();
        if (CANONICAL_PATTERN.matcher(trimmed).matches() || ISO_PATTERN.matcher(trimmed).matches()) {
            return startOfDay(parse(trimmed));
        }
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(trimmed, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) {
                return ((ZonedDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
