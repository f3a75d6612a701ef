package com.runtree.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Standard {@link Coercion}s for attribute tables. All of them pass {@code null} through.
 */
public final class Coercions {

    public static final Coercion<String> STRING = value -> {
        if (value == null || value instanceof String) return (String) value;
        if (value instanceof CharSequence) return value.toString();
        throw new IllegalArgumentException("expected 'String', got '" + typeName(value) + "'");
    };

    public static final Coercion<Integer> INTEGER = value -> {
        if (value == null || value instanceof Integer) return (Integer) value;
        if (value instanceof Number n) return n.intValue();
        if (value instanceof String s) return s.isBlank() ? null : Integer.valueOf(s.trim());
        throw new IllegalArgumentException("expected 'Integer', got '" + typeName(value) + "'");
    };

    public static final Coercion<Boolean> BOOLEAN = value -> {
        if (value == null || value instanceof Boolean) return (Boolean) value;
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s)) return Boolean.TRUE;
            if ("false".equalsIgnoreCase(s)) return Boolean.FALSE;
        }
        throw new IllegalArgumentException("expected 'Boolean', got '" + typeName(value) + "'");
    };

    public static final Coercion<LocalDateTime> DATE_TIME = value -> {
        if (value == null || value instanceof LocalDateTime) return (LocalDateTime) value;
        if (value instanceof String s) return s.isEmpty() ? null : Timestamps.parse(s);
        throw new IllegalArgumentException("expected ISO-8601 timestamp, got '" + typeName(value) + "'");
    };

    /** Seconds as a number, or a {@link Duration}. */
    public static final Coercion<Duration> DURATION = value -> {
        if (value == null || value instanceof Duration) return (Duration) value;
        if (value instanceof Number n) return Timestamps.seconds(n.doubleValue());
        if (value instanceof String s) return Timestamps.seconds(Double.parseDouble(s));
        throw new IllegalArgumentException("expected seconds, got '" + typeName(value) + "'");
    };

    public static final Coercion<Path> PATH = value -> {
        if (value == null || value instanceof Path) return (Path) value;
        if (value instanceof String s) return s.isEmpty() ? null : Path.of(s);
        throw new IllegalArgumentException("expected path, got '" + typeName(value) + "'");
    };

    /** Immutable ordered sequence of strings; any iterable or array is accepted. */
    public static final Coercion<List<String>> STRING_SEQUENCE = value -> {
        if (value == null) return List.of();
        List<String> result = new ArrayList<>();
        for (Object item : asList(value)) {
            result.add(STRING.coerce(item));
        }
        return Collections.unmodifiableList(result);
    };

    /** Ordered string mapping; values are converted with {@link String#valueOf(Object)}. */
    public static final Coercion<Map<String, String>> STRING_MAP = value -> {
        if (value == null) return new LinkedHashMap<>();
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("expected mapping, got '" + typeName(value) + "'");
        }
        Map<String, String> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), v == null ? null : String.valueOf(v)));
        return result;
    };

    /** Mutable list view of any iterable or array; used for nested model collections. */
    public static final Coercion<List<Object>> LIST = value -> value == null ? List.of() : asList(value);

    private Coercions() {
    }

    public static <E extends Enum<E>> Coercion<E> enumValue(Class<E> type, Function<String, E> fromValue) {
        return value -> {
            if (value == null || type.isInstance(value)) return type.cast(value);
            if (value instanceof String s) return fromValue.apply(s);
            throw new IllegalArgumentException("expected '" + type.getSimpleName() + "', got '" + typeName(value) + "'");
        };
    }

    /** True for values that can be turned into an ordered sequence. */
    public static boolean isSequence(Object value) {
        return value instanceof Iterable<?> || (value != null && value.getClass().isArray());
    }

    public static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static List<Object> asList(Object value) {
        if (value instanceof Iterable<?> iterable) {
            List<Object> list = new ArrayList<>();
            iterable.forEach(list::add);
            return list;
        }
        if (value instanceof Object[] array) {
            return new ArrayList<>(Arrays.asList(array));
        }
        throw new IllegalArgumentException("expected sequence, got '" + typeName(value) + "'");
    }
}
