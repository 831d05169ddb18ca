package com.phillippitts.voicechat.util;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Utility methods for change-row timestamps and elapsed time calculations.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses an ISO-8601 timestamp as written by the database.
     *
     * <p>Accepts offset forms ({@code 2024-01-01T00:00:00+00:00}, {@code ...Z}), local forms
     * without offset ({@code 2024-01-01T00:00:00}, read as UTC) and the space-separated
     * variant ({@code 2024-01-01 00:00:00+00:00}).
     *
     * @param value timestamp text
     * @return parsed timestamp
     * @throws DateTimeParseException if the value is not an ISO-8601 date-time
     * @throws IllegalArgumentException if the value is null or blank
     */
    public static OffsetDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Timestamp must not be blank");
        }
        String normalized = value.trim().replace(' ', 'T');
        try {
            return OffsetDateTime.parse(normalized);
        } catch (DateTimeParseException ignored) {
            // no offset: fall through to local form
        }
        return LocalDateTime.parse(normalized).atOffset(ZoneOffset.UTC);
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }
}
