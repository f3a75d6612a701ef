package com.runtree.model.result;

import com.runtree.model.Coercions;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Tag set of tests and keywords. Tags are compared ignoring case, spaces and underscores:
 * a duplicate keeps the spelling added first, removal matches normalized names, and iteration
 * is sorted by normalized name. Empty tags are ignored.
 */
public final class Tags implements Iterable<String> {

    private final Map<String, String> byNormalized = new TreeMap<>();

    public Tags() {
    }

    public Tags(Iterable<String> tags) {
        add(tags);
    }

    public static Tags of(String... tags) {
        return new Tags(List.of(tags));
    }

    public Tags add(String tag) {
        if (tag != null) {
            String key = normalize(tag);
            if (!key.isEmpty()) {
                byNormalized.putIfAbsent(key, tag);
            }
        }
        return this;
    }

    public Tags add(Iterable<String> tags) {
        if (tags != null) {
            tags.forEach(this::add);
        }
        return this;
    }

    public Tags remove(String tag) {
        if (tag != null) {
            byNormalized.remove(normalize(tag));
        }
        return this;
    }

    public Tags remove(Iterable<String> tags) {
        if (tags != null) {
            tags.forEach(this::remove);
        }
        return this;
    }

    public boolean contains(String tag) {
        return tag != null && byNormalized.containsKey(normalize(tag));
    }

    /**
     * Whether any tag matches the glob {@code pattern} ({@code *} and {@code ?}), compared in
     * normalized form.
     */
    public boolean match(String pattern) {
        if (pattern == null) return false;
        Pattern regex = globToRegex(normalize(pattern));
        for (String key : byNormalized.keySet()) {
            if (regex.matcher(key).matches()) return true;
        }
        return false;
    }

    private static Pattern globToRegex(String glob) {
        StringBuilder sb = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }

    public int size() {
        return byNormalized.size();
    }

    public boolean isEmpty() {
        return byNormalized.isEmpty();
    }

    /** Tags in iteration order, as a new list. */
    public List<String> asList() {
        return new ArrayList<>(byNormalized.values());
    }

    @Override
    public Iterator<String> iterator() {
        return asList().iterator();
    }

    /** Coerces a single tag, an iterable or array of tags, or a {@link Tags} (copied). */
    static Tags coerce(Object value) {
        Tags tags = new Tags();
        if (value == null) return tags;
        if (value instanceof String tag) return tags.add(tag);
        for (Object item : Coercions.LIST.coerce(value)) {
            tags.add(Coercions.STRING.coerce(item));
        }
        return tags;
    }

    static String normalize(String tag) {
        StringBuilder sb = new StringBuilder(tag.length());
        for (int i = 0; i < tag.length(); i++) {
            char c = tag.charAt(i);
            if (c != '_' && !Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tags other)) return false;
        return byNormalized.keySet().equals(other.byNormalized.keySet());
    }

    @Override
    public int hashCode() {
        return byNormalized.keySet().hashCode();
    }

    @Override
    public String toString() {
        return asList().toString();
    }
}
