package io.gridflow.renewables.transform;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Converts raw timestamp cells to UTC instants.
 */
public final class Timestamps {
    // yyyy-MM-dd[( |T)HH:mm[:ss[.fraction]]][+HH:MM|+HHMM|Z]
    private static final DateTimeFormatter TEXT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .optionalEnd()
            .toFormatter();

    private Timestamps() {}

    /**
     * @return the instant, or null for a null cell
     * @throws IllegalArgumentException if the cell does not match the unit
     */
    public static Instant toInstant(Object value, TimestampUnit unit) {
        if (value == null) return null;
        if (value instanceof Instant i) return i;
        return switch (unit) {
            case TEXT -> parseText(value);
            case EPOCH_MILLIS -> Instant.ofEpochMilli(epoch(value));
            case EPOCH_SECONDS -> Instant.ofEpochSecond(epoch(value));
        };
    }

    public static Instant parseText(Object value) {
        if (!(value instanceof CharSequence cs)) {
            throw new IllegalArgumentException("expected date-time text but got " + value.getClass().getSimpleName());
        }
        String text = cs.toString().strip();
        TemporalAccessor parsed;
        try {
            parsed = TEXT.parseBest(text, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("not a date-time: '" + text + "'", e);
        }
        if (parsed instanceof OffsetDateTime odt) return odt.toInstant();
        if (parsed instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
        return ((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    private static long epoch(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isFinite(d) || d != Math.rint(d)) throw new IllegalArgumentException("not an integral epoch: " + value);
            return (long) d;
        }
        if (value instanceof CharSequence cs) {
            try {
                return Long.parseLong(cs.toString().strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not an integral epoch: '" + cs + "'", e);
            }
        }
        throw new IllegalArgumentException("not an integral epoch: " + value);
    }
}
