package com.runtree.xml.handlers;

import com.runtree.model.DataException;
import com.runtree.model.result.Body;
import com.runtree.model.result.Keyword;
import com.runtree.model.result.Status;
import com.runtree.model.result.TestCase;
import com.runtree.model.result.TestSuite;
import com.runtree.xml.InvalidElementException;
import com.runtree.xml.ReportElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * {@code <kw>}: keywords, setups and teardowns, and the FOR loops and iterations of reports
 * written before loops had their own elements.
 *
 * <p>A keyword without a type directly under a suite goes into the suite setup while the
 * suite has no tests or child suites, and into its teardown after that. A missing fixture is
 * created as "Implicit setup" or "Implicit teardown" with PASS status; a real setup or
 * teardown read later replaces its attributes and keeps the body.
 */
final class KeywordHandler extends AbstractElementHandler {

    private static final Logger log = LoggerFactory.getLogger(KeywordHandler.class);

    enum Kind {
        KEYWORD, SETUP, TEARDOWN, FOR, FORITEM, ITERATION;

        /**
         * @throws DataException for types other than the ones above
         */
        static Kind of(String type) {
            if (type == null || type.isEmpty()) return KEYWORD;
            try {
                return valueOf(type.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new DataException("Unsupported keyword type '" + type + "'.", e);
            }
        }
    }

    KeywordHandler() {
        // "arguments", "assign" and "tags" are the pre-"arg"/"var"/"tag" format
        super("kw", "doc", "arguments", "arg", "assign", "var", "tags", "tag", "timeout", "status",
                "msg", "kw", "if", "for", "try", "while", "group", "variable", "return",
                "break", "continue", "error");
    }

    @Override
    public Optional<Object> start(ReportElement element, Object parent) {
        return Optional.of(switch (Kind.of(element.get("type"))) {
            case KEYWORD -> createKeyword(element, parent);
            case SETUP -> fixture(element, parent, true).config(keywordData(element));
            case TEARDOWN -> fixture(element, parent, false).config(keywordData(element));
            case FOR -> createLegacyFor(element, parent);
            case FORITEM, ITERATION -> createLegacyIteration(element, parent);
        });
    }

    private static Keyword createKeyword(ReportElement element, Object parent) {
        Body body = parent instanceof TestSuite suite
                ? implicitFixture(suite).getBody()
                : bodyOf(element, parent);
        return body.createKeyword(keywordData(element));
    }

    private static Keyword implicitFixture(TestSuite suite) {
        boolean teardown = !suite.getTests().isEmpty() || !suite.getSuites().isEmpty();
        Keyword fixture = teardown ? suite.getTeardown() : suite.getSetup();
        if (!fixture.isDefined()) {
            fixture.setName(teardown ? "Implicit teardown" : "Implicit setup");
            fixture.setStatus(Status.PASS);
            log.debug("Created {} for suite-level keyword in suite '{}'", fixture.getName(), suite.getName());
        }
        return fixture;
    }

    private static Keyword fixture(ReportElement element, Object parent, boolean setup) {
        if (parent instanceof TestSuite suite) return setup ? suite.getSetup() : suite.getTeardown();
        if (parent instanceof TestCase test) return setup ? test.getSetup() : test.getTeardown();
        if (parent instanceof Keyword keyword) return setup ? keyword.getSetup() : keyword.getTeardown();
        throw new InvalidElementException(element.getTag(), parent);
    }

    private static Object createLegacyFor(ReportElement element, Object parent) {
        log.debug("Converting legacy FOR keyword '{}'", element.get("name"));
        return bodyOf(element, parent).createFor(LegacyLoops.forData(element.get("name")));
    }

    private static Object createLegacyIteration(ReportElement element, Object parent) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("assign", LegacyLoops.iterationAssign(element.get("name")));
        return bodyOf(element, parent).createIteration(data);
    }

    private static Map<String, Object> keywordData(ReportElement element) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", element.get("name", ""));
        data.put("owner", firstNonEmpty(element.get("owner"), element.get("library")));
        data.put("source_name", firstNonEmpty(element.get("source_name"), element.get("sourcename")));
        return data;
    }

    private static String firstNonEmpty(String value, String fallback) {
        return value != null && !value.isEmpty() ? value : fallback;
    }
}
