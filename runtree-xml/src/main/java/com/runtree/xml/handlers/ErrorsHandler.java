package com.runtree.xml.handlers;

import com.runtree.model.result.Result;
import com.runtree.xml.ElementHandler;
import com.runtree.xml.ElementHandlerRegistry;
import com.runtree.xml.ReportElement;

import java.util.Optional;

/**
 * {@code <errors>}: every child, whatever its tag, is an execution error message.
 */
final class ErrorsHandler extends AbstractElementHandler {

    private final ElementHandler messageHandler = new MessageHandler(true);

    ErrorsHandler() {
        super("errors");
    }

    @Override
    public ElementHandler getChildHandler(String childTag, ElementHandlerRegistry registry) {
        return messageHandler;
    }

    @Override
    public Optional<Object> start(ReportElement element, Object parent) {
        return Optional.of(as(Result.class, element, parent).getErrors());
    }
}
