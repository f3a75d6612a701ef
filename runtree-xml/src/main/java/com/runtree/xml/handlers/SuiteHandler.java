package com.runtree.xml.handlers;

import com.runtree.model.result.Result;
import com.runtree.model.result.TestSuite;
import com.runtree.xml.ElementHandler;
import com.runtree.xml.ElementHandlerRegistry;
import com.runtree.xml.InvalidElementException;
import com.runtree.xml.ReportElement;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The root suite configures the result's existing suite; nested suites are created.
 * A suite's own {@code <status>} never sets its status, which is computed from its children.
 */
final class SuiteHandler extends AbstractElementHandler {

    private final ElementHandler statusHandler = new StatusHandler(false);

    SuiteHandler() {
        // "metadata" is the pre-"meta" format
        super("suite", "doc", "metadata", "meta", "status", "kw", "test", "suite");
    }

    @Override
    public ElementHandler getChildHandler(String childTag, ElementHandlerRegistry registry) {
        if ("status".equals(childTag)) {
            return statusHandler;
        }
        return super.getChildHandler(childTag, registry);
    }

    @Override
    public Optional<Object> start(ReportElement element, Object parent) {
        if (parent instanceof Result result) {
            return Optional.of(result.getSuite().config(suiteData(element, result.isRpa())));
        }
        if (parent instanceof TestSuite suite) {
            return Optional.of(suite.createSuite(suiteData(element, suite.getRpa())));
        }
        throw new InvalidElementException(element.getTag(), parent);
    }

    private static Map<String, Object> suiteData(ReportElement element, Boolean rpa) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", element.get("name", ""));
        data.put("source", element.get("source"));
        data.put("rpa", rpa);
        return data;
    }
}
