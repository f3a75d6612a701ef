package com.runtree.xml.handlers;

import com.runtree.model.result.For;
import com.runtree.model.result.ItemType;
import com.runtree.model.result.Iteration;
import com.runtree.model.result.Keyword;
import com.runtree.model.result.Var;
import com.runtree.xml.InvalidElementException;
import com.runtree.xml.ReportElement;

/**
 * {@code <var>} means different things depending on where it appears: an assigned variable of
 * a plain keyword (not a setup or teardown), a loop variable of a FOR, a {@code name=value} binding of an iteration, or one
 * value of a VAR.
 */
final class VarHandler extends AbstractElementHandler {

    VarHandler() {
        super("var");
    }

    @Override
    public void end(ReportElement element, Object node) {
        String value = element.getText();
        if (node instanceof Keyword keyword && keyword.getType() == ItemType.KEYWORD) {
            keyword.addAssign(value);
        } else if (node instanceof For loop) {
            loop.addAssign(value);
        } else if (node instanceof Iteration iteration) {
            iteration.getAssign().put(element.get("name", ""), value);
        } else if (node instanceof Var var) {
            var.addValue(value);
        } else {
            throw new InvalidElementException(element.getTag(), node);
        }
    }
}
