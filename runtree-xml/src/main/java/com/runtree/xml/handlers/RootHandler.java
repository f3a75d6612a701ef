package com.runtree.xml.handlers;

import com.runtree.xml.ElementHandler;
import com.runtree.xml.ElementHandlerRegistry;
import com.runtree.xml.IncompatibleElementException;

/**
 * Outermost element: {@code <robot>} or a bare {@code <suite>}.
 */
final class RootHandler extends AbstractElementHandler {

    RootHandler() {
        super(null, "robot", "suite");
    }

    @Override
    public ElementHandler getChildHandler(String childTag, ElementHandlerRegistry registry) {
        if (!children().contains(childTag)) {
            throw IncompatibleElementException.root(childTag);
        }
        return registry.forTag(childTag);
    }
}
