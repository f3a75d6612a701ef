package com.runtree.xml.handlers;

import com.runtree.model.result.Keyword;
import com.runtree.model.result.TestCase;
import com.runtree.xml.InvalidElementException;
import com.runtree.xml.ReportElement;

final class TagHandler extends AbstractElementHandler {

    TagHandler() {
        super("tag");
    }

    @Override
    public void end(ReportElement element, Object node) {
        if (node instanceof TestCase test) {
            test.getTags().add(element.getText());
        } else if (node instanceof Keyword keyword) {
            keyword.getTags().add(element.getText());
        } else {
            throw new InvalidElementException(element.getTag(), node);
        }
    }
}
