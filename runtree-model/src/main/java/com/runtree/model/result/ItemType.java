package com.runtree.model.result;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Discriminant of body items, written as the {@code type} field of their dictionaries.
 * Branch types ({@link #IF}, {@link #ELSE_IF}, {@link #ELSE}, {@link #TRY}, {@link #EXCEPT},
 * {@link #FINALLY}) all map to {@link Branch}.
 */
public enum ItemType {
    KEYWORD("KEYWORD"),
    SETUP("SETUP"),
    TEARDOWN("TEARDOWN"),
    FOR("FOR"),
    ITERATION("ITERATION"),
    WHILE("WHILE"),
    GROUP("GROUP"),
    IF_ELSE_ROOT("IF/ELSE ROOT"),
    IF("IF"),
    ELSE_IF("ELSE IF"),
    ELSE("ELSE"),
    TRY_EXCEPT_ROOT("TRY/EXCEPT ROOT"),
    TRY("TRY"),
    EXCEPT("EXCEPT"),
    FINALLY("FINALLY"),
    VAR("VAR"),
    RETURN("RETURN"),
    CONTINUE("CONTINUE"),
    BREAK("BREAK"),
    ERROR("ERROR"),
    MESSAGE("MESSAGE");

    private static final Set<ItemType> BRANCHES = EnumSet.of(IF, ELSE_IF, ELSE, TRY, EXCEPT, FINALLY);

    private final String value;

    ItemType(String value) {
        this.value = value;
    }

    /** Value used in dictionaries and reports, e.g. {@code "ELSE IF"}. */
    public String getValue() {
        return value;
    }

    public boolean isBranch() {
        return BRANCHES.contains(this);
    }

    /**
     * @throws IllegalArgumentException for unknown values
     */
    public static ItemType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (ItemType type : values()) {
                if (type.value.equals(normalized) || type.name().equals(normalized)) return type;
            }
        }
        throw new IllegalArgumentException("Unsupported body item type '" + value + "'.");
    }

    @Override
    public String toString() {
        return value;
    }
}
