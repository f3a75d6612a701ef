package com.runtree.model;

/**
 * Converts a raw configuration value (typically from a dictionary loaded from JSON) into
 * the Java type an attribute stores. Implementations throw {@link IllegalArgumentException}
 * or {@link ClassCastException} when the value has the wrong shape.
 *
 * @param <V> attribute value type
 */
@FunctionalInterface
public interface Coercion<V> {

    V coerce(Object value);
}
