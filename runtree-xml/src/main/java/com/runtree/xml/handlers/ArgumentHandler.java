package com.runtree.xml.handlers;

import com.runtree.model.result.Keyword;
import com.runtree.xml.ReportElement;

final class ArgumentHandler extends AbstractElementHandler {

    ArgumentHandler() {
        super("arg");
    }

    @Override
    public void end(ReportElement element, Object node) {
        as(Keyword.class, element, node).addArg(element.getText());
    }
}
