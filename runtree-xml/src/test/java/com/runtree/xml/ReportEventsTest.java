package com.runtree.xml;

import org.junit.jupiter.api.Test;

import javax.xml.stream.XMLStreamException;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ReportEventsTest {

    @Test
    void text_isCharacterDataBeforeFirstChild() throws XMLStreamException {
        List<String> ends = stream("<a>head<b>inner</b>tail<b><![CDATA[x<y]]></b>more</a>");
        assertEquals(List.of("b=inner", "b=x<y", "a=head"), ends);
    }

    @Test
    void text_ofElementStartingWithChildIsNull() throws XMLStreamException {
        List<String> ends = stream("<a><b/>after</a>");
        assertEquals(List.of("b=null", "a=null"), ends);
    }

    @Test
    void text_keepsEntitiesAndWhitespace() throws XMLStreamException {
        List<String> ends = stream("<a>  1 &lt; 2  </a>");
        assertEquals(List.of("a=  1 < 2  "), ends);
    }

    private static List<String> stream(String xml) throws XMLStreamException {
        List<String> ends = new ArrayList<>();
        ElementHandler b = recording("b", Set.of(), ends);
        ElementHandler a = recording("a", Set.of("b"), ends);
        ElementHandler root = recording(null, Set.of("a"), ends);
        ElementStack stack = new ElementStack("root", new ElementHandlerRegistry(root, List.of(a, b)), SubtreeFilter.NONE);
        ReportEvents.stream(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), stack);
        assertEquals(0, stack.depth());
        return ends;
    }

    private static ElementHandler recording(String tag, Set<String> children, List<String> ends) {
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
            public void end(ReportElement element, Object node) {
                ends.add(element.getTag() + "=" + (element.hasText() ? element.getText() : null));
            }
        };
    }
}
