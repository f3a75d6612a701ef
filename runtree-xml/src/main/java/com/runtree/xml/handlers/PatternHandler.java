package com.runtree.xml.handlers;

import com.runtree.model.result.Branch;
import com.runtree.xml.ReportElement;

final class PatternHandler extends AbstractElementHandler {

    PatternHandler() {
        super("pattern");
    }

    @Override
    public void end(ReportElement element, Object node) {
        as(Branch.class, element, node).addPattern(element.getText());
    }
}
