package com.runtree.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * ISO-8601 timestamps and second-based durations as used in dictionary/JSON data.
 */
public final class Timestamps {

    private static final DateTimeFormatter ISO_MICROS = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS");

    private Timestamps() {
    }

    /**
     * Parses {@code 2023-01-01T12:00:00.000000}; a space instead of {@code T} is accepted too.
     *
     * @throws DateTimeParseException when the text is not an ISO-8601 local date-time
     */
    public static LocalDateTime parse(String text) {
        String trimmed = text.trim();
        if (trimmed.length() > 10 && trimmed.charAt(10) == ' ') {
            trimmed = trimmed.substring(0, 10) + 'T' + trimmed.substring(11);
        }
        return LocalDateTime.parse(trimmed);
    }

    /** Formats with microsecond precision, e.g. {@code 2023-01-01T12:00:00.000000}. */
    public static String format(LocalDateTime timestamp) {
        return timestamp == null ? null : ISO_MICROS.format(timestamp);
    }

    public static Duration seconds(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
    }

    public static double toSeconds(Duration duration) {
        if (duration == null) return 0d;
        return duration.getSeconds() + duration.getNano() / 1_000_000_000d;
    }
}
