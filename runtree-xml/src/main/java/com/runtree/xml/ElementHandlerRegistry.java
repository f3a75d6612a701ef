package com.runtree.xml;

import com.runtree.xml.handlers.StandardHandlers;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single responsibility: map a tag name to its ElementHandler.
 *
 * <p>The table is built once from a fixed list; there is no registration after construction.
 * The root handler is kept apart because it is never looked up by tag.
 */
public final class ElementHandlerRegistry {

    private static final ElementHandlerRegistry STANDARD =
            new ElementHandlerRegistry(StandardHandlers.root(), StandardHandlers.all());

    private final ElementHandler root;
    private final Map<String, ElementHandler> handlers = new HashMap<>();

    /**
     * @throws IllegalArgumentException if two handlers claim the same tag
     */
    public ElementHandlerRegistry(ElementHandler root, List<ElementHandler> handlerList) {
        this.root = root;
        for (ElementHandler handler : handlerList) {
            ElementHandler previous = handlers.putIfAbsent(handler.tag(), handler);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate handler for tag '" + handler.tag() + "'.");
            }
        }
    }

    /** Handlers for every element of the current and legacy report formats. */
    public static ElementHandlerRegistry standard() {
        return STANDARD;
    }

    public ElementHandler root() {
        return root;
    }

    /**
     * @throws IllegalStateException if a handler permits a child tag that has no handler
     */
    public ElementHandler forTag(String tag) {
        ElementHandler handler = handlers.get(tag);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for tag '" + tag + "'.");
        }
        return handler;
    }

    public Set<String> tags() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
