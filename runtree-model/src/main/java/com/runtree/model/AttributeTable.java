package com.runtree.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Declared attributes of one model type: name, getter, optional setter and value coercion.
 * Drives {@link ModelObject#config(Map)} and therefore {@code fromDict}/{@code fromJson}.
 * Attributes without a setter are read-only; configuring them is accepted only when the
 * given value equals the current one (body items carry their fixed {@code type} in dictionary data).
 *
 * @param <T> model type
 */
public final class AttributeTable<T> {

    private final String typeName;
    private final Map<String, Attribute<T, ?>> attributes;

    private AttributeTable(String typeName, Map<String, Attribute<T, ?>> attributes) {
        this.typeName = typeName;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static <T> Builder<T> builder(String typeName) {
        return new Builder<>(typeName);
    }

    public String getTypeName() {
        return typeName;
    }

    public Set<String> names() {
        return attributes.keySet();
    }

    public boolean isReadOnly(String name) {
        return require(name).setter == null;
    }

    public Object get(T target, String name) {
        return require(name).getter.apply(target);
    }

    /**
     * Applies the given attributes in iteration order. Read-only attributes are verified after
     * all settable ones so that derived values (e.g. a suite's computed status) see the full data.
     *
     * @throws AttributeException for unknown attributes, uncoercible values or read-only conflicts
     */
    public void configure(T target, Map<String, ?> values) {
        Map<Attribute<T, ?>, Object> readOnly = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            Attribute<T, ?> attribute = require(entry.getKey());
            if (attribute.setter == null) {
                readOnly.put(attribute, entry.getValue());
            } else {
                attribute.set(target, entry.getValue());
            }
        }
        readOnly.forEach((attribute, value) -> attribute.verifyUnchanged(target, value));
    }

    private Attribute<T, ?> require(String name) {
        Attribute<T, ?> attribute = attributes.get(name);
        if (attribute == null) {
            throw new AttributeException(typeName, name,
                    "'" + typeName + "' object does not have attribute '" + name + "'");
        }
        return attribute;
    }

    private static final class Attribute<T, V> {
        private final String typeName;
        private final String name;
        private final Function<T, V> getter;
        private final BiConsumer<T, V> setter;
        private final Coercion<V> coercion;
        private final boolean sequence;

        private Attribute(String typeName, String name, Function<T, V> getter, BiConsumer<T, V> setter,
                          Coercion<V> coercion, boolean sequence) {
            this.typeName = typeName;
            this.name = name;
            this.getter = getter;
            this.setter = setter;
            this.coercion = coercion;
            this.sequence = sequence;
        }

        void set(T target, Object value) {
            if (sequence && value != null && !Coercions.isSequence(value)) {
                throw new AttributeException(typeName, name, "'" + typeName + "' object attribute '" + name
                        + "' is a sequence, got '" + Coercions.typeName(value) + "'.");
            }
            setter.accept(target, coerce(value));
        }

        void verifyUnchanged(T target, Object value) {
            V current = getter.apply(target);
            V given;
            try {
                given = coerce(value);
            } catch (AttributeException e) {
                throw new AttributeException(typeName, name, "Setting attribute '" + name + "' failed: "
                        + e.getMessage(), e);
            }
            if (!Objects.equals(current, given)) {
                throw new AttributeException(typeName, name, "Setting attribute '" + name + "' failed: '"
                        + typeName + "' attribute '" + name + "' is read-only (current value '" + current
                        + "', got '" + value + "').");
            }
        }

        private V coerce(Object value) {
            try {
                return coercion.coerce(value);
            } catch (DataException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new AttributeException(typeName, name, "Setting attribute '" + name + "' of '"
                        + typeName + "' failed: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Fluent declaration of a type's attributes, in the order they should be applied and shown.
     */
    public static final class Builder<T> {
        private final String typeName;
        private final Map<String, Attribute<T, ?>> attributes = new LinkedHashMap<>();

        private Builder(String typeName) {
            this.typeName = Objects.requireNonNull(typeName, "typeName");
        }

        public <V> Builder<T> add(String name, Function<T, V> getter, BiConsumer<T, V> setter, Coercion<V> coercion) {
            return put(name, getter, Objects.requireNonNull(setter, "setter"), coercion, false);
        }

        public <V> Builder<T> readOnly(String name, Function<T, V> getter, Coercion<V> coercion) {
            return put(name, getter, null, coercion, false);
        }

        /** Immutable ordered sequence of strings (args, assign, values, patterns, ...). */
        public Builder<T> sequence(String name, Function<T, List<String>> getter, BiConsumer<T, List<String>> setter) {
            return put(name, getter, Objects.requireNonNull(setter, "setter"), Coercions.STRING_SEQUENCE, true);
        }

        private <V> Builder<T> put(String name, Function<T, V> getter, BiConsumer<T, V> setter,
                                   Coercion<V> coercion, boolean sequence) {
            attributes.put(name, new Attribute<>(typeName, name, getter, setter, coercion, sequence));
            return this;
        }

        public AttributeTable<T> build() {
            return new AttributeTable<>(typeName, attributes);
        }
    }
}
