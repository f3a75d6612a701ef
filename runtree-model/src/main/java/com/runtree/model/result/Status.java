package com.runtree.model.result;

import java.util.Locale;

/**
 * Execution status of suites, tests, keywords and control structures.
 */
public enum Status {
    PASS("PASS"),
    FAIL("FAIL"),
    SKIP("SKIP"),
    NOT_RUN("NOT RUN"),
    /** Structural default for items whose status has not been recorded. */
    NOT_SET("NOT SET");

    private final String value;

    Status(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @throws IllegalArgumentException for unknown values
     */
    public static Status fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT).replace('_', ' ');
            for (Status status : values()) {
                if (status.value.equals(normalized)) return status;
            }
        }
        throw new IllegalArgumentException("Invalid status '" + value + "'.");
    }

    @Override
    public String toString() {
        return value;
    }
}
