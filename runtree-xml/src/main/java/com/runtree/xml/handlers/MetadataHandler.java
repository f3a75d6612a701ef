package com.runtree.xml.handlers;

import com.runtree.model.result.TestSuite;
import com.runtree.xml.ReportElement;

/**
 * One metadata entry: {@code <meta name="x">value</meta>}, or {@code <item>} inside the older
 * {@code <metadata>} wrapper. A repeated name replaces the earlier value.
 */
final class MetadataHandler extends AbstractElementHandler {

    MetadataHandler(String tag) {
        super(tag);
    }

    @Override
    public void end(ReportElement element, Object node) {
        as(TestSuite.class, element, node).getMetadata().put(element.get("name", ""), element.getText());
    }
}
