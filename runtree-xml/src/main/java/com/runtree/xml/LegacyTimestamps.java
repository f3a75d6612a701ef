package com.runtree.xml;

import com.runtree.model.DataException;
import com.runtree.model.Timestamps;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Timestamps of reports written before the ISO-8601 format: {@code 20230101 12:00:00.000},
 * parsed by position. Shorter values are padded with zeros, so {@code 20230101 12:00} works too.
 */
public final class LegacyTimestamps {

    static final String NOT_AVAILABLE = "N/A";
    private static final int WIDTH = 24;

    private LegacyTimestamps() {
    }

    /**
     * @return null for {@code N/A}, null or empty values
     * @throws DataException if the digits at the fixed positions do not form a timestamp
     */
    public static LocalDateTime parse(String value) {
        if (value == null || value.isEmpty() || NOT_AVAILABLE.equals(value)) {
            return null;
        }
        String padded = padRight(value);
        try {
            return LocalDateTime.of(
                    field(padded, 0, 4),
                    field(padded, 4, 6),
                    field(padded, 6, 8),
                    field(padded, 9, 11),
                    field(padded, 12, 14),
                    field(padded, 15, 17),
                    field(padded, 18, 24) * 1000);
        } catch (NumberFormatException | DateTimeException e) {
            throw new DataException("Invalid timestamp '" + value + "'.", e);
        }
    }

    /** ISO-8601 first, the legacy positional format second; null for empty values. */
    public static LocalDateTime parseGenerated(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Timestamps.parse(value);
        } catch (DateTimeParseException e) {
            return parse(value);
        }
    }

    private static String padRight(String value) {
        if (value.length() >= WIDTH) return value;
        StringBuilder padded = new StringBuilder(WIDTH).append(value);
        while (padded.length() < WIDTH) {
            padded.append('0');
        }
        return padded.toString();
    }

    private static int field(String value, int from, int to) {
        return Integer.parseInt(value.substring(from, to));
    }
}
