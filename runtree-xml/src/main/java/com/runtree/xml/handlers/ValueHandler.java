package com.runtree.xml.handlers;

import com.runtree.model.result.ErrorItem;
import com.runtree.model.result.For;
import com.runtree.model.result.Return;
import com.runtree.xml.InvalidElementException;
import com.runtree.xml.ReportElement;

/** Iterated values of FOR, returned values of RETURN and values of an invalid-syntax ERROR. */
final class ValueHandler extends AbstractElementHandler {

    ValueHandler() {
        super("value");
    }

    @Override
    public void end(ReportElement element, Object node) {
        String value = element.getText();
        if (node instanceof For loop) {
            loop.addValue(value);
        } else if (node instanceof Return ret) {
            ret.addValue(value);
        } else if (node instanceof ErrorItem error) {
            error.addValue(value);
        } else {
            throw new InvalidElementException(element.getTag(), node);
        }
    }
}
