package com.runtree.xml;

import com.ctc.wstx.stax.WstxInputFactory;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Feeds the elements of a report document to an {@link ElementStack} using the Woodstox
 * StAX2 reader. The text of an element is the character data before its first child
 * element; text of nested elements and text following a child are not included.
 */
final class ReportEvents {

    private static final XMLInputFactory2 FACTORY = createFactory();

    private ReportEvents() {
    }

    /** Reads the whole document; the stream is left open. */
    static void stream(InputStream in, ElementStack stack) throws XMLStreamException {
        XMLStreamReader2 reader = (XMLStreamReader2) FACTORY.createXMLStreamReader(in);
        Deque<OpenElement> open = new ArrayDeque<>();
        try {
            while (reader.hasNext()) {
                switch (reader.next()) {
                    case XMLStreamConstants.START_ELEMENT -> {
                        ReportElement element = new ReportElement(reader.getLocalName(), attributes(reader));
                        stack.start(element);
                        if (!open.isEmpty()) {
                            open.peek().hasChildren = true;
                        }
                        open.push(new OpenElement(element));
                    }
                    case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE -> {
                        OpenElement current = open.peek();
                        if (current != null && !current.hasChildren) {
                            current.text.append(reader.getTextCharacters(), reader.getTextStart(), reader.getTextLength());
                        }
                    }
                    case XMLStreamConstants.END_ELEMENT -> {
                        OpenElement closed = open.pop();
                        stack.end(closed.element.withText(closed.text.length() == 0 ? null : closed.text.toString()));
                    }
                    default -> {
                        // comments, processing instructions and the document prolog carry nothing
                    }
                }
            }
        } finally {
            reader.close();
        }
    }

    private static Map<String, String> attributes(XMLStreamReader2 reader) {
        int count = reader.getAttributeCount();
        Map<String, String> attributes = new LinkedHashMap<>(count * 2);
        for (int i = 0; i < count; i++) {
            attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
        }
        return attributes;
    }

    /** An element whose end has not been seen; text is collected only until its first child starts. */
    private static final class OpenElement {
        private final ReportElement element;
        private final StringBuilder text = new StringBuilder();
        private boolean hasChildren;

        private OpenElement(ReportElement element) {
            this.element = element;
        }
    }

    private static XMLInputFactory2 createFactory() {
        XMLInputFactory2 factory = new WstxInputFactory();
        factory.configureForSpeed();
        factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.TRUE);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        return factory;
    }
}
