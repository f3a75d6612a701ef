package com.runtree.xml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Stack automaton turning start/end element events into a result tree.
 *
 * <p>Each frame pairs the handler of an open element with the node it produced. The stack is
 * seeded with the root handler and the object being populated. On start the top handler
 * validates the child tag; the child's handler runs only when the enclosing node is present
 * and the {@link SubtreeFilter} does not suppress it. On end the frame is popped and its
 * handler finishes the node, again only when present. An absent node therefore silences the
 * whole subtree while its tags are still checked.
 *
 * <p>Not thread-safe; one instance per parse.
 */
public final class ElementStack {

    private static final Logger log = LoggerFactory.getLogger(ElementStack.class);

    private final ElementHandlerRegistry registry;
    private final SubtreeFilter filter;
    private final Deque<Frame> frames = new ArrayDeque<>();

    public ElementStack(Object root) {
        this(root, ElementHandlerRegistry.standard(), SubtreeFilter.NONE);
    }

    public ElementStack(Object root, ElementHandlerRegistry registry, SubtreeFilter filter) {
        this.registry = registry;
        this.filter = filter;
        frames.push(new Frame(registry.root(), Optional.of(root)));
    }

    /**
     * @throws IncompatibleElementException if the element is not permitted where it appears
     */
    public void start(ReportElement element) {
        Frame top = frames.peek();
        ElementHandler handler = top.handler.getChildHandler(element.getTag(), registry);
        Optional<Object> node = Optional.empty();
        if (top.node.isPresent()) {
            if (filter.suppress(top.handler.tag(), element)) {
                log.debug("Suppressing {} under '{}'", element, top.handler.tag());
            } else {
                node = handler.start(element, top.node.get());
            }
        }
        frames.push(new Frame(handler, node));
    }

    /**
     * @param element the closed element with its text
     * @throws IllegalStateException if there is no open element to close
     */
    public void end(ReportElement element) {
        if (frames.size() == 1) {
            throw new IllegalStateException("No open element to close for " + element + ".");
        }
        Frame frame = frames.pop();
        if (frame.node.isPresent()) {
            frame.handler.end(element, frame.node.get());
        }
    }

    /** Number of open elements. */
    public int depth() {
        return frames.size() - 1;
    }

    private static final class Frame {
        private final ElementHandler handler;
        private final Optional<Object> node;

        private Frame(ElementHandler handler, Optional<Object> node) {
            this.handler = handler;
            this.node = node;
        }
    }
}
