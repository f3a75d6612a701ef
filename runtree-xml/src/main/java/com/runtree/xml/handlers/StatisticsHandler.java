package com.runtree.xml.handlers;

import com.runtree.xml.ElementHandler;
import com.runtree.xml.ElementHandlerRegistry;
import com.runtree.xml.IncompatibleElementException;
import com.runtree.xml.ReportElement;

import java.util.Optional;

/**
 * {@code <statistics>}: validated but not read, statistics are computed from the tree.
 * The handler also stands for its descendants.
 */
final class StatisticsHandler extends AbstractElementHandler {

    StatisticsHandler() {
        super("statistics", "total", "tag", "suite", "stat");
    }

    @Override
    public ElementHandler getChildHandler(String childTag, ElementHandlerRegistry registry) {
        if (!children().contains(childTag)) {
            throw IncompatibleElementException.child(tag(), childTag);
        }
        return this;
    }

    @Override
    public Optional<Object> start(ReportElement element, Object parent) {
        return Optional.empty();
    }
}
