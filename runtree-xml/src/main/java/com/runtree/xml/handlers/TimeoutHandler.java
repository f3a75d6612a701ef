package com.runtree.xml.handlers;

import com.runtree.model.result.Keyword;
import com.runtree.model.result.TestCase;
import com.runtree.xml.InvalidElementException;
import com.runtree.xml.ReportElement;

final class TimeoutHandler extends AbstractElementHandler {

    TimeoutHandler() {
        super("timeout");
    }

    @Override
    public void end(ReportElement element, Object node) {
        String timeout = element.get("value");
        if (node instanceof TestCase test) {
            test.setTimeout(timeout);
        } else if (node instanceof Keyword keyword) {
            keyword.setTimeout(timeout);
        } else {
            throw new InvalidElementException(element.getTag(), node);
        }
    }
}
