package com.runtree.xml.handlers;

import com.runtree.xml.ReportElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * IF/ELSE and TRY/EXCEPT branches. All attributes go to the branch as is, except the older
 * {@code variable} which is read as {@code assign}.
 */
final class BranchHandler extends AbstractElementHandler {

    private static final Logger log = LoggerFactory.getLogger(BranchHandler.class);

    BranchHandler() {
        super("branch", "status", "kw", "if", "for", "try", "while", "group", "msg", "doc", "variable",
                "return", "pattern", "break", "continue", "error");
    }

    @Override
    public Optional<Object> start(ReportElement element, Object parent) {
        if (element.has("variable")) {
            log.debug("Reading branch attribute 'variable' as 'assign'");
            element = element.withRenamedAttribute("variable", "assign");
        }
        return Optional.of(bodyOf(element, parent).createBranch(new LinkedHashMap<>(element.getAttributes())));
    }
}
