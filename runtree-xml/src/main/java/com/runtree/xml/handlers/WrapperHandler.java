package com.runtree.xml.handlers;

/**
 * Grouping elements of older reports ({@code <tags>}, {@code <arguments>}, {@code <assign>},
 * {@code <metadata>}) whose children apply to the enclosing node directly.
 */
final class WrapperHandler extends AbstractElementHandler {

    WrapperHandler(String tag, String child) {
        super(tag, child);
    }
}
