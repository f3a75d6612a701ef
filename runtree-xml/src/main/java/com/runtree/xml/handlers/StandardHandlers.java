package com.runtree.xml.handlers;

import com.runtree.model.result.Body;
import com.runtree.model.result.Var;
import com.runtree.xml.ElementHandler;
import com.runtree.xml.ReportElement;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handlers for the current report format and the tags and attributes of older ones.
 */
public final class StandardHandlers {

    private StandardHandlers() {
    }

    public static ElementHandler root() {
        return new RootHandler();
    }

    public static List<ElementHandler> all() {
        return List.of(
                new RobotHandler(),
                new SuiteHandler(),
                new TestHandler(),
                new KeywordHandler(),
                new BodyItemHandler("for",
                        (body, e) -> body.createFor(AbstractElementHandler.attributes(e, "flavor", "start", "mode", "fill")),
                        "var", "value", "iter", "status", "doc", "msg", "kw"),
                new BodyItemHandler("while",
                        (body, e) -> body.createWhile(
                                AbstractElementHandler.attributes(e, "condition", "limit", "on_limit", "on_limit_message")),
                        "iter", "status", "doc", "msg", "kw"),
                new BodyItemHandler("iter", (body, e) -> body.createIteration(),
                        "var", "doc", "status", "kw", "if", "for", "msg", "try", "while", "group",
                        "variable", "return", "break", "continue", "error"),
                new BodyItemHandler("group", (body, e) -> body.createGroup(Map.of("name", e.get("name", ""))),
                        "status", "kw", "if", "for", "try", "while", "group", "msg", "variable",
                        "return", "break", "continue", "error"),
                new BodyItemHandler("if", (body, e) -> body.createIf(), "branch", "status", "doc", "msg", "kw"),
                new BodyItemHandler("try", (body, e) -> body.createTry(), "branch", "status", "doc", "msg", "kw"),
                new BranchHandler(),
                new PatternHandler(),
                new BodyItemHandler("variable", StandardHandlers::createVar, "var", "status", "msg", "kw"),
                new BodyItemHandler("return", (body, e) -> body.createReturn(), "value", "status", "msg", "kw"),
                new BodyItemHandler("continue", (body, e) -> body.createContinue(), "status", "msg", "kw"),
                new BodyItemHandler("break", (body, e) -> body.createBreak(), "status", "msg", "kw"),
                new BodyItemHandler("error", (body, e) -> body.createError(), "status", "msg", "value", "kw"),
                new MessageHandler(false),
                new StatusHandler(true),
                new DocHandler(),
                new WrapperHandler("metadata", "item"),
                new MetadataHandler("item"),
                new MetadataHandler("meta"),
                new WrapperHandler("tags", "tag"),
                new TagHandler(),
                new TimeoutHandler(),
                new WrapperHandler("assign", "var"),
                new VarHandler(),
                new WrapperHandler("arguments", "arg"),
                new ArgumentHandler(),
                new ValueHandler(),
                new ErrorsHandler(),
                new StatisticsHandler());
    }

    private static Var createVar(Body body, ReportElement element) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", element.get("name", ""));
        data.putAll(AbstractElementHandler.attributes(element, "scope", "separator"));
        return body.createVar(data);
    }
}
