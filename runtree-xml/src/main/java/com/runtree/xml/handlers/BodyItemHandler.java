package com.runtree.xml.handlers;

import com.runtree.model.result.Body;
import com.runtree.model.result.BodyItem;
import com.runtree.xml.ReportElement;

import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Control structures and other body items: created through the enclosing node's {@link Body}
 * so the same handler works under tests, keywords and other control structures.
 */
final class BodyItemHandler extends AbstractElementHandler {

    private final BiFunction<Body, ReportElement, BodyItem> factory;

    BodyItemHandler(String tag, BiFunction<Body, ReportElement, BodyItem> factory, String... children) {
        super(tag, children);
        this.factory = factory;
    }

    @Override
    public Optional<Object> start(ReportElement element, Object parent) {
        return Optional.of(factory.apply(bodyOf(element, parent), element));
    }
}
