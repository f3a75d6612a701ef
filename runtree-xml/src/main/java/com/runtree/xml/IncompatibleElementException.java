package com.runtree.xml;

import com.runtree.model.DataException;

/**
 * Thrown when an element appears where its parent does not permit it, or when the outermost
 * element is not a report root.
 */
public final class IncompatibleElementException extends DataException {

    private final String parentTag;
    private final String childTag;

    private IncompatibleElementException(String parentTag, String childTag, String message) {
        super(message);
        this.parentTag = parentTag;
        this.childTag = childTag;
    }

    public static IncompatibleElementException root(String tag) {
        return new IncompatibleElementException(null, tag, "Incompatible root element '" + tag + "'.");
    }

    public static IncompatibleElementException child(String parentTag, String childTag) {
        return new IncompatibleElementException(parentTag, childTag,
                "Incompatible child element '" + childTag + "' for '" + parentTag + "'.");
    }

    /** Tag of the enclosing element; null for the root case. */
    public String getParentTag() {
        return parentTag;
    }

    public String getChildTag() {
        return childTag;
    }

    public boolean isRoot() {
        return parentTag == null;
    }
}
