package de.bsommerfeld.moltgraph.core.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Lenient parsing of the timestamp strings the API emits. Seen in the wild:
 * {@code 2026-01-30T12:00:00Z}, {@code 2026-01-30T12:00:00.123+00:00},
 * zone-less local date-times, and epoch seconds or milliseconds as numbers.
 * Zone-less values are taken as UTC.
 */
public final class Timestamps {

    // Anything below this is epoch seconds, above it epoch millis.
    private static final long MILLIS_THRESHOLD = 100_000_000_000L;

    private Timestamps() {
    }

    public static Optional<Instant> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (value.chars().allMatch(Character::isDigit)) {
            return fromEpoch(value);
        }
        Optional<Instant> withOffset = parseOffset(value);
        return withOffset.isPresent() ? withOffset : parseLocal(value);
    }

    private static Optional<Instant> parseOffset(String value) {
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseLocal(String value) {
        try {
            return Optional.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Interprets a number as epoch seconds or epoch milliseconds depending on
     * its magnitude.
     */
    public static Instant fromEpochNumber(long value) {
        return value < MILLIS_THRESHOLD ? Instant.ofEpochSecond(value) : Instant.ofEpochMilli(value);
    }

    private static Optional<Instant> fromEpoch(String digits) {
        try {
            return Optional.of(fromEpochNumber(Long.parseLong(digits)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
