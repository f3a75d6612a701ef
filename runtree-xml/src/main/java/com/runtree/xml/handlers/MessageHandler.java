package com.runtree.xml.handlers;

import com.runtree.model.result.ExecutionErrors;
import com.runtree.xml.LegacyTimestamps;
import com.runtree.xml.ReportElement;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code <msg>} in a body, or any element of the {@code <errors>} section.
 */
final class MessageHandler extends AbstractElementHandler {

    private final boolean executionErrors;

    MessageHandler(boolean executionErrors) {
        super("msg");
        this.executionErrors = executionErrors;
    }

    @Override
    public void end(ReportElement element, Object node) {
        Map<String, Object> data = messageData(element);
        if (executionErrors) {
            as(ExecutionErrors.class, element, node).createMessage(data);
        } else {
            bodyOf(element, node).createMessage(data);
        }
    }

    private static Map<String, Object> messageData(ReportElement element) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", element.getText());
        data.put("level", element.get("level", "INFO"));
        // "yes" is the older spelling
        data.put("html", "true".equals(element.get("html")) || "yes".equals(element.get("html")));
        if (element.has("time")) {
            data.put("timestamp", element.get("time"));
        } else {
            data.put("timestamp", LegacyTimestamps.parse(element.get("timestamp")));
        }
        return data;
    }
}
