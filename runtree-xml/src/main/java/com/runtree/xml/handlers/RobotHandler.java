package com.runtree.xml.handlers;

import com.runtree.model.result.Result;
import com.runtree.xml.LegacyTimestamps;
import com.runtree.xml.ReportElement;

import java.util.Optional;

final class RobotHandler extends AbstractElementHandler {

    RobotHandler() {
        super("robot", "suite", "statistics", "errors");
    }

    @Override
    public Optional<Object> start(ReportElement element, Object parent) {
        Result result = as(Result.class, element, parent);
        result.setGenerator(element.get("generator", "unknown"));
        result.setGenerated(LegacyTimestamps.parseGenerated(element.get("generated")));
        if (result.getRpa() == null) {
            result.setRpa("true".equals(element.get("rpa", "false")));
        }
        return Optional.of(result);
    }
}
