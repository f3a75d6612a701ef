package com.runtree.xml.handlers;

import com.runtree.model.result.Keyword;
import com.runtree.model.result.StatusObject;
import com.runtree.model.result.TestCase;
import com.runtree.model.result.TestSuite;
import com.runtree.xml.InvalidElementException;
import com.runtree.xml.ReportElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Documentation of suites, tests and keywords. Control structures of older reports carry a
 * {@code <doc>} with notes about flattened or removed content; that text becomes the message.
 */
final class DocHandler extends AbstractElementHandler {

    private static final Logger log = LoggerFactory.getLogger(DocHandler.class);

    DocHandler() {
        super("doc");
    }

    @Override
    public void end(ReportElement element, Object node) {
        String doc = element.getText();
        if (node instanceof Keyword keyword) {
            keyword.setDoc(doc);
        } else if (node instanceof TestCase test) {
            test.setDoc(doc);
        } else if (node instanceof TestSuite suite) {
            suite.setDoc(doc);
        } else if (node instanceof StatusObject<?> item) {
            log.debug("Using legacy <doc> as message of {}", item);
            item.setMessage(doc);
        } else {
            throw new InvalidElementException(element.getTag(), node);
        }
    }
}
