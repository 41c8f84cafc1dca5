package com.storicard.warehouse.transform;

import java.sql.Timestamp;
import java.text.ParsePosition;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQuery;
import java.util.Date;
import java.util.Locale;

/**
 * Lenient date parsing for source columns that arrive either typed or as free-form text.
 */
public final class FlexibleDateParsers {

    /**
     * Text formats tried in order. Slash dates are month-first unless that gives no valid date.
     * <ol>
     * <li>{@code yyyy-MM-dd} (ISO)</li>
     * <li>{@code d-MMM-yyyy}</li>
     * <li>{@code d-MMM-yy}, e.g. {@code 29-Jun-17}</li>
     * <li>{@code d MMM yyyy}</li>
     * <li>{@code MM/dd/yyyy}</li>
     * <li>{@code dd/MM/yyyy}</li>
     * <li>{@code yyyy/MM/dd}</li>
     * </ol>
     * All of them resolve strictly, so impossible dates such as {@code 31/04/2017} are rejected.
     */
    static final DateTimeFormatter[] DATE_FORMATTERS = {
        DateTimeFormatter.ISO_LOCAL_DATE,
        caseInsensitive("d-MMM-uuuu"),
        caseInsensitive("d-MMM-uu"),
        caseInsensitive("d MMM uuuu"),
        strict("MM/dd/uuuu"),
        strict("dd/MM/uuuu"),
        strict("uuuu/MM/dd")
    };

    private FlexibleDateParsers() {
    }

    /**
     * Converts a source value to a {@link LocalDate}. Date-times are truncated to their date
     * (UTC for instants). Null and blank values give null.
     *
     * @throws IllegalArgumentException when the value is not a recognisable date
     */
    public static LocalDate toLocalDate(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toLocalDate();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDate();
        }
        if (value instanceof Instant) {
            return LocalDate.ofInstant((Instant) value, ZoneOffset.UTC);
        }
        if (value instanceof Date) {
            return LocalDate.ofInstant(((Date) value).toInstant(), ZoneOffset.UTC);
        }
        String text = value.toString().trim();
        if (text.isEmpty() || text.equalsIgnoreCase("nat") || text.equalsIgnoreCase("null")) {
            return null;
        }
        DateTimeParseException rejected = null;
        for (DateTimeFormatter formatter : DATE_FORMATTERS) {
            if (!matches(text, formatter)) {
                continue;
            }
            try {
                return formatter.parse(text, LocalDate::from);
            } catch (DateTimeParseException e) {
                rejected = e;
            }
        }
        if (rejected != null) {
            throw new IllegalArgumentException("Invalid date: " + text, rejected);
        }
        String dateTime = text.replace(' ', 'T');
        if (matches(dateTime, DateTimeFormatter.ISO_LOCAL_DATE_TIME)) {
            return resolve(dateTime, DateTimeFormatter.ISO_LOCAL_DATE_TIME, LocalDateTime::from).toLocalDate();
        }
        throw new IllegalArgumentException("Unrecognised date: " + text);
    }

    private static boolean matches(String text, DateTimeFormatter formatter) {
        ParsePosition position = new ParsePosition(0);
        TemporalAccessor parsed = formatter.parseUnresolved(text, position);
        return parsed != null && position.getErrorIndex() < 0 && position.getIndex() == text.length();
    }

    private static <T> T resolve(String text, DateTimeFormatter formatter, TemporalQuery<T> query) {
        try {
            return formatter.parse(text, query);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date: " + text, e);
        }
    }

    private static DateTimeFormatter caseInsensitive(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }
}
