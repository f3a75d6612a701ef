package com.runtree.model;

import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Base of every node in the result tree: construction from a dictionary, serialization to a
 * dictionary or JSON, attribute configuration, shallow and deep copies, and a textual form
 * built from {@link #reprAttributes()}.
 *
 * <p>Subclasses declare their attributes once in a static {@link AttributeTable} and expose a
 * static {@code fromDict}/{@code fromJson} pair that delegates to {@link #fromDict(Supplier, Map)}.
 *
 * @param <T> the concrete model type
 */
public abstract class ModelObject<T extends ModelObject<T>> implements Cloneable {

    protected abstract AttributeTable<T> attributeTable();

    /**
     * Serializes this object into an insertion-ordered map of plain values (strings, numbers,
     * booleans, lists and maps). {@code fromDict} of the result restores an equivalent object.
     */
    public abstract Map<String, Object> toDict();

    /**
     * Sets the given attributes. Values for immutable sequences may be any iterable or array;
     * read-only attributes are accepted only when the value does not change.
     *
     * @throws AttributeException if an attribute is unknown or its value is invalid
     */
    public T config(Map<String, ?> attributes) {
        attributeTable().configure(self(), attributes);
        return self();
    }

    public T config(String name, Object value) {
        return config(Collections.singletonMap(name, value));
    }

    /** Current value of a declared attribute. */
    public Object getAttribute(String name) {
        return attributeTable().get(self(), name);
    }

    /** Shallow copy: contained collections such as tags and bodies are shared with this object. */
    public T copy() {
        return copy(Map.of());
    }

    public T copy(Map<String, ?> attributes) {
        return shallowCopy().config(attributes);
    }

    /** Recursive copy: no mutable state is shared with this object. */
    public T deepCopy() {
        return deepCopy(Map.of());
    }

    public T deepCopy(Map<String, ?> attributes) {
        T copy = shallowCopy();
        copy.copyStateDeeply();
        return copy.config(attributes);
    }

    /**
     * Called on a fresh shallow copy by {@link #deepCopy(Map)}; replaces every shared mutable
     * field with an independent copy. Overrides must call {@code super}.
     */
    protected void copyStateDeeply() {
    }

    public String toJson() {
        return toJson(JsonFormat.DEFAULT);
    }

    public String toJson(JsonFormat format) {
        return ModelJson.write(toDict(), format);
    }

    public void toJson(Writer out, JsonFormat format) {
        ModelJson.write(toDict(), out, format);
    }

    public void toJson(Path path, JsonFormat format) {
        ModelJson.write(toDict(), path, format);
    }

    /** Attribute names shown by {@link #toString()}, in order. */
    protected List<String> reprAttributes() {
        return List.of();
    }

    protected boolean includeInRepr(String name, Object value) {
        return true;
    }

    protected String reprFormat(String name, Object value) {
        return repr(value);
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        for (String name : reprAttributes()) {
            Object value = getAttribute(name);
            if (includeInRepr(name, value)) {
                parts.add(name + "=" + reprFormat(name, value));
            }
        }
        return attributeTable().getTypeName() + "(" + String.join(", ", parts) + ")";
    }

    @SuppressWarnings("unchecked")
    protected final T self() {
        return (T) this;
    }

    @SuppressWarnings("unchecked")
    private T shallowCopy() {
        try {
            return (T) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new AssertionError(e);
        }
    }

    /**
     * Creates a default instance and configures it with the dictionary's keys as attribute names.
     *
     * @throws AttributeException naming the type when construction fails
     */
    protected static <T extends ModelObject<T>> T fromDict(Supplier<T> factory, Map<String, ?> data) {
        T object = factory.get();
        try {
            return object.config(data);
        } catch (AttributeException e) {
            String type = object.attributeTable().getTypeName();
            throw new AttributeException(type, e.getAttribute(),
                    "Creating '" + type + "' object from dictionary failed: " + e.getMessage(), e);
        }
    }

    /** Literal form used by {@link #toString()}: strings single-quoted, iterables bracketed. */
    protected static String repr(Object value) {
        if (value instanceof String s) {
            return "'" + s.replace("\\", "\\\\").replace("'", "\\'") + "'";
        }
        if (value instanceof Iterable<?> items) {
            List<String> parts = new ArrayList<>();
            items.forEach(item -> parts.add(repr(item)));
            return "[" + String.join(", ", parts) + "]";
        }
        return String.valueOf(value);
    }
}
