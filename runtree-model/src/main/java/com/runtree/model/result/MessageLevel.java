package com.runtree.model.result;

import java.util.Locale;

/**
 * Severity of a log {@link Message}.
 */
public enum MessageLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FAIL,
    SKIP;

    /**
     * Case-insensitive; {@code null} or blank means {@link #INFO}.
     *
     * @throws IllegalArgumentException for unknown levels
     */
    public static MessageLevel fromValue(String value) {
        if (value == null || value.isBlank()) return INFO;
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (MessageLevel level : values()) {
            if (level.name().equals(normalized)) return level;
        }
        throw new IllegalArgumentException("Invalid message level '" + value + "'.");
    }
}
