package com.runtree.xml.handlers;

import com.runtree.model.result.TestSuite;
import com.runtree.xml.ReportElement;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

final class TestHandler extends AbstractElementHandler {

    TestHandler() {
        // "tags" is the pre-"tag" format
        super("test", "doc", "tags", "tag", "timeout", "status", "kw", "if", "for", "try", "while",
                "group", "variable", "return", "break", "continue", "error", "msg");
    }

    @Override
    public Optional<Object> start(ReportElement element, Object parent) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", element.get("name", ""));
        data.put("lineno", element.get("line"));
        return Optional.of(as(TestSuite.class, element, parent).createTest(data));
    }
}
