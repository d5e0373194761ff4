package com.hydrosentinel.core.validation;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * Interprets the timestamp encodings sensors are known to send.
 *
 * <ul>
 * <li>ISO-8601 instants, with or without offset ({@code 2025-02-07T10:15:30.5Z});
 * values without an offset are taken as UTC</li>
 * <li>epoch seconds, possibly fractional ({@code 1738923330.25})</li>
 * <li>epoch milliseconds ({@code 1738923330250}); any number of at least
 * {@value #MILLIS_CUTOFF} is read as milliseconds</li>
 * </ul>
 *
 * @since 1.0.0
 */
final class TimestampParser {

    /** Epoch seconds reach this value only in the year 5138. */
    static final double MILLIS_CUTOFF = 1e11;

    private TimestampParser() {
    }

    static Optional<Instant> parse(Object raw) {
        if (raw instanceof Instant instant) {
            return Optional.of(instant);
        }
        if (raw instanceof Number n) {
            return fromEpoch(n.doubleValue());
        }
        if (raw instanceof String s && !s.isBlank()) {
            return fromText(s.trim());
        }
        return Optional.empty();
    }

    private static Optional<Instant> fromEpoch(double epoch) {
        if (!Double.isFinite(epoch) || epoch < 0) {
            return Optional.empty();
        }
        if (epoch >= MILLIS_CUTOFF) {
            return Optional.of(Instant.ofEpochMilli((long) epoch));
        }
        long seconds = (long) epoch;
        long nanos = Math.round((epoch - seconds) * 1_000_000_000L);
        return Optional.of(Instant.ofEpochSecond(seconds, nanos));
    }

    private static Optional<Instant> fromText(String text) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text,
                    ZonedDateTime::from, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof LocalDateTime local) {
                return Optional.of(local.toInstant(ZoneOffset.UTC));
            }
            return Optional.of(Instant.from(parsed));
        } catch (DateTimeParseException e) {
            return fromNumericText(text);
        }
    }

    private static Optional<Instant> fromNumericText(String text) {
        try {
            return fromEpoch(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
