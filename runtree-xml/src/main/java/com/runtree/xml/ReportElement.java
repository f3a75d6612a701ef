package com.runtree.xml;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One element of a report as seen by the handlers: tag, attributes and, on end events, the
 * element's own character data.
 */
public final class ReportElement {

    private final String tag;
    private final Map<String, String> attributes;
    private final String text;

    public ReportElement(String tag, Map<String, String> attributes) {
        this(tag, attributes, null);
    }

    public ReportElement(String tag, Map<String, String> attributes, String text) {
        this.tag = tag;
        this.attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.text = text;
    }

    public static ReportElement of(String tag) {
        return new ReportElement(tag, Map.of());
    }

    public String getTag() {
        return tag;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String get(String name) {
        return attributes.get(name);
    }

    public String get(String name, String defaultValue) {
        return attributes.getOrDefault(name, defaultValue);
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    /** Text content, or an empty string when the element had none. */
    public String getText() {
        return text != null ? text : "";
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public ReportElement withText(String text) {
        return new ReportElement(tag, attributes, text);
    }

    /** Copy where attribute {@code from} is renamed to {@code to}; unchanged if {@code from} is absent. */
    public ReportElement withRenamedAttribute(String from, String to) {
        if (!attributes.containsKey(from)) return this;
        Map<String, String> renamed = new LinkedHashMap<>();
        attributes.forEach((name, value) -> renamed.put(name.equals(from) ? to : name, value));
        return new ReportElement(tag, renamed, text);
    }

    @Override
    public String toString() {
        return "<" + tag + (attributes.isEmpty() ? "" : " " + attributes) + ">";
    }
}
