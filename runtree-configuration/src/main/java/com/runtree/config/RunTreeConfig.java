package com.runtree.config;

import com.runtree.model.JsonFormat;

import java.util.Map;
import java.util.Objects;

/**
 * Reading and serialization options, loaded from environment variables.
 * <p>
 * RUNTREE_INCLUDE_KEYWORDS: when false, keywords and control structures inside tests and suites
 * are skipped while reading a report (setups and teardowns are kept without their bodies).
 * <p>
 * RUNTREE_JSON_INDENT, RUNTREE_JSON_ENSURE_ASCII: default output formatting for JSON.
 */
public final class RunTreeConfig {

    private static final String ENV_INCLUDE_KEYWORDS = "RUNTREE_INCLUDE_KEYWORDS";
    private static final String ENV_JSON_INDENT = "RUNTREE_JSON_INDENT";
    private static final String ENV_JSON_ENSURE_ASCII = "RUNTREE_JSON_ENSURE_ASCII";

    private static final boolean DEFAULT_INCLUDE_KEYWORDS = true;
    private static final int DEFAULT_JSON_INDENT = 0;
    private static final boolean DEFAULT_JSON_ENSURE_ASCII = false;

    private static final RunTreeConfig DEFAULTS = builder().build();

    private final boolean includeKeywords;
    private final int jsonIndent;
    private final boolean jsonEnsureAscii;

    private RunTreeConfig(Builder b) {
        this.includeKeywords = b.includeKeywords;
        this.jsonIndent = b.jsonIndent;
        this.jsonEnsureAscii = b.jsonEnsureAscii;
    }

    /** Configuration with every option at its default. */
    public static RunTreeConfig defaults() {
        return DEFAULTS;
    }

    /** Whether keyword and control structure bodies are materialized (RUNTREE_INCLUDE_KEYWORDS). Default true. */
    public boolean isIncludeKeywords() {
        return includeKeywords;
    }

    /** Spaces per nesting level in JSON output (RUNTREE_JSON_INDENT). Default 0, meaning compact. */
    public int getJsonIndent() {
        return jsonIndent;
    }

    /** Whether JSON output escapes non-ASCII characters (RUNTREE_JSON_ENSURE_ASCII). Default false. */
    public boolean isJsonEnsureAscii() {
        return jsonEnsureAscii;
    }

    /** JSON output format built from the indent and ASCII options, with compact separators. */
    public JsonFormat getJsonFormat() {
        return JsonFormat.DEFAULT.withIndent(jsonIndent).withEnsureAscii(jsonEnsureAscii);
    }

    public static RunTreeConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reading the given variables; invalid values fall back to defaults. */
    public static RunTreeConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .includeKeywords(parseBoolean(env.get(ENV_INCLUDE_KEYWORDS), DEFAULT_INCLUDE_KEYWORDS))
                .jsonIndent(parseInt(env.get(ENV_JSON_INDENT), DEFAULT_JSON_INDENT))
                .jsonEnsureAscii(parseBoolean(env.get(ENV_JSON_ENSURE_ASCII), DEFAULT_JSON_ENSURE_ASCII))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v)) return true;
        if ("false".equalsIgnoreCase(v) || "0".equals(v)) return false;
        return defaultValue;
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed >= 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "RunTreeConfig(includeKeywords=" + includeKeywords + ", jsonIndent=" + jsonIndent
                + ", jsonEnsureAscii=" + jsonEnsureAscii + ")";
    }

    public static final class Builder {
        private boolean includeKeywords = DEFAULT_INCLUDE_KEYWORDS;
        private int jsonIndent = DEFAULT_JSON_INDENT;
        private boolean jsonEnsureAscii = DEFAULT_JSON_ENSURE_ASCII;

        public Builder includeKeywords(boolean includeKeywords) {
            this.includeKeywords = includeKeywords;
            return this;
        }

        public Builder jsonIndent(int jsonIndent) {
            if (jsonIndent < 0) {
                throw new IllegalArgumentException("jsonIndent must be >= 0: " + jsonIndent);
            }
            this.jsonIndent = jsonIndent;
            return this;
        }

        public Builder jsonEnsureAscii(boolean jsonEnsureAscii) {
            this.jsonEnsureAscii = jsonEnsureAscii;
            return this;
        }

        public RunTreeConfig build() {
            return new RunTreeConfig(this);
        }
    }
}
