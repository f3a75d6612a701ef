package com.runtree.xml;

import java.util.Optional;
import java.util.Set;

/**
 * Single responsibility: validate the children of one report element and build or finish the
 * node it stands for.
 *
 * <p>{@link #start} receives the node of the enclosing element and returns the node that the
 * element's children should populate. An empty result suppresses the whole subtree: children
 * are still validated but none of their handlers run.
 */
public interface ElementHandler {

    /** Tag this handler is registered for. */
    String tag();

    /** Tags permitted directly beneath this element. */
    Set<String> children();

    /**
     * @throws IncompatibleElementException if {@code childTag} is not one of {@link #children()}
     */
    default ElementHandler getChildHandler(String childTag, ElementHandlerRegistry registry) {
        if (!children().contains(childTag)) {
            throw IncompatibleElementException.child(tag(), childTag);
        }
        return registry.forTag(childTag);
    }

    default Optional<Object> start(ReportElement element, Object parent) {
        return Optional.of(parent);
    }

    default void end(ReportElement element, Object node) {
    }
}
