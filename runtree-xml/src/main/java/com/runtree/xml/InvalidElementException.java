package com.runtree.xml;

import com.runtree.model.DataException;

/**
 * Thrown when an element is permitted by its parent's handler but the node being built does
 * not support what the element sets, e.g. a {@code <var>} inside a {@code <return>}.
 */
public final class InvalidElementException extends DataException {

    private final String tag;
    private final transient Object node;

    public InvalidElementException(String tag, Object node) {
        super("Invalid element '" + tag + "' for result '" + node + "'.");
        this.tag = tag;
        this.node = node;
    }

    public String getTag() {
        return tag;
    }

    public Object getNode() {
        return node;
    }
}
