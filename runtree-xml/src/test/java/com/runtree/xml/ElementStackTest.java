package com.runtree.xml;

import com.runtree.model.result.Result;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ElementStackTest {

    @Test
    void startAndEnd_buildTree() {
        Result result = new Result();
        ElementStack stack = new ElementStack(result);
        stack.start(new ReportElement("robot", Map.of("generator", "Test")));
        stack.start(new ReportElement("suite", Map.of("name", "Root")));
        stack.start(ReportElement.of("doc"));
        assertEquals(3, stack.depth());
        stack.end(ReportElement.of("doc").withText("Root docs."));
        stack.end(ReportElement.of("suite"));
        stack.end(ReportElement.of("robot"));

        assertEquals(0, stack.depth());
        assertEquals("Test", result.getGenerator());
        assertEquals("Root", result.getSuite().getName());
        assertEquals("Root docs.", result.getSuite().getDoc());
    }

    @Test
    void start_rejectsIncompatibleChild() {
        ElementStack stack = new ElementStack(new Result());
        stack.start(ReportElement.of("robot"));
        stack.start(ReportElement.of("suite"));
        IncompatibleElementException e = assertThrows(IncompatibleElementException.class,
                () -> stack.start(ReportElement.of("arg")));
        assertEquals("Incompatible child element 'arg' for 'suite'.", e.getMessage());
    }

    @Test
    void start_rejectsIncompatibleRoot() {
        ElementStack stack = new ElementStack(new Result());
        IncompatibleElementException e = assertThrows(IncompatibleElementException.class,
                () -> stack.start(ReportElement.of("test")));
        assertTrue(e.isRoot());
        assertEquals("test", e.getChildTag());
    }

    @Test
    void emptyNodeSuppressesSubtreeButKeepsValidating() {
        List<String> calls = new ArrayList<>();
        ElementHandler skipping = handler("skip", Set.of("leaf"), Optional.empty(), calls);
        ElementHandler leaf = handler("leaf", Set.of(), Optional.of("leaf"), calls);
        ElementHandler root = handler(null, Set.of("skip"), Optional.of("root"), calls);
        ElementStack stack = new ElementStack("root", new ElementHandlerRegistry(root, List.of(skipping, leaf)), SubtreeFilter.NONE);

        stack.start(ReportElement.of("skip"));
        stack.start(ReportElement.of("leaf"));
        stack.end(ReportElement.of("leaf"));
        assertThrows(IncompatibleElementException.class, () -> stack.start(ReportElement.of("other")));
        stack.end(ReportElement.of("skip"));

        assertEquals(List.of("start skip"), calls);
    }

    @Test
    void filterSuppressesMatchingElements() {
        List<String> calls = new ArrayList<>();
        ElementHandler leaf = handler("leaf", Set.of(), Optional.of("leaf"), calls);
        ElementHandler root = handler(null, Set.of("leaf"), Optional.of("root"), calls);
        SubtreeFilter filter = (parentTag, element) -> "yes".equals(element.get("hide"));
        ElementStack stack = new ElementStack("root", new ElementHandlerRegistry(root, List.of(leaf)), filter);

        stack.start(new ReportElement("leaf", Map.of("hide", "yes")));
        stack.end(ReportElement.of("leaf"));
        stack.start(ReportElement.of("leaf"));
        stack.end(ReportElement.of("leaf"));

        assertEquals(List.of("start leaf", "end leaf"), calls);
    }

    @Test
    void end_withoutOpenElementFails() {
        ElementStack stack = new ElementStack(new Result());
        assertThrows(IllegalStateException.class, () -> stack.end(ReportElement.of("robot")));
    }

    @Test
    void registry_rejectsDuplicateTags() {
        ElementHandler first = handler("x", Set.of(), Optional.empty(), new ArrayList<>());
        ElementHandler second = handler("x", Set.of(), Optional.empty(), new ArrayList<>());
        assertThrows(IllegalArgumentException.class, () -> new ElementHandlerRegistry(first, List.of(first, second)));
    }

    @Test
    void standardRegistry_resolvesEveryPermittedChild() {
        ElementHandlerRegistry registry = ElementHandlerRegistry.standard();
        for (String tag : registry.tags()) {
            ElementHandler handler = registry.forTag(tag);
            for (String child : handler.children()) {
                assertNotNull(handler.getChildHandler(child, registry), "child '" + child + "' of '" + tag + "'");
            }
        }
        for (String child : registry.root().children()) {
            assertEquals(child, registry.root().getChildHandler(child, registry).tag());
        }
    }

    private static ElementHandler handler(String tag, Set<String> children, Optional<Object> node, List<String> calls) {
        return new ElementHandler() {
            @Override
            public String tag() {
                return tag;
            }

            @Override
            public Set<String> children() {
                return children;
            }

            @Override
            public Optional<Object> start(ReportElement element, Object parent) {
                calls.add("start " + element.getTag());
                return node;
            }

            @Override
            public void end(ReportElement element, Object result) {
                calls.add("end " + element.getTag());
            }
        };
    }
}
