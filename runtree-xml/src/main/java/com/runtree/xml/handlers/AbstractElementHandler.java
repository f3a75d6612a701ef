package com.runtree.xml.handlers;

import com.runtree.model.result.Body;
import com.runtree.model.result.StatusItem;
import com.runtree.model.result.TestCase;
import com.runtree.xml.ElementHandler;
import com.runtree.xml.InvalidElementException;
import com.runtree.xml.ReportElement;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Tag and permitted children, plus lookups shared by the handlers.
 */
abstract class AbstractElementHandler implements ElementHandler {

    private final String tag;
    private final Set<String> children;

    protected AbstractElementHandler(String tag, String... children) {
        this.tag = tag;
        this.children = Set.of(children);
    }

    @Override
    public String tag() {
        return tag;
    }

    @Override
    public Set<String> children() {
        return children;
    }

    /** Body of a test, keyword or control structure. */
    static Body bodyOf(ReportElement element, Object node) {
        if (node instanceof StatusItem<?> item) return item.getBody();
        if (node instanceof TestCase test) return test.getBody();
        throw new InvalidElementException(element.getTag(), node);
    }

    static <T> T as(Class<T> type, ReportElement element, Object node) {
        if (type.isInstance(node)) return type.cast(node);
        throw new InvalidElementException(element.getTag(), node);
    }

    /** The named attributes that are present, in the given order. */
    static Map<String, Object> attributes(ReportElement element, String... names) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (String name : names) {
            if (element.has(name)) {
                data.put(name, element.get(name));
            }
        }
        return data;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + tag + "]";
    }
}
