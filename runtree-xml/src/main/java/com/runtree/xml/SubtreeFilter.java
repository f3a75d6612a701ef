package com.runtree.xml;

import java.util.Set;

/**
 * Decides which elements are left out of the tree even though they are permitted where they
 * appear. A suppressed element and everything beneath it are still validated.
 */
@FunctionalInterface
public interface SubtreeFilter {

    SubtreeFilter NONE = (parentTag, element) -> false;

    /**
     * @param parentTag tag of the enclosing element, null directly under the document root
     */
    boolean suppress(String parentTag, ReportElement element);

    /**
     * Leaves out keywords, control structures and messages of suites, tests and keywords.
     * Setups and teardowns of suites and tests are kept with their status, without their bodies.
     * Execution errors are always kept.
     */
    static SubtreeFilter omitKeywords() {
        return OmitKeywords.INSTANCE;
    }

    /** {@link #omitKeywords()} when {@code includeKeywords} is false, {@link #NONE} otherwise. */
    static SubtreeFilter forKeywords(boolean includeKeywords) {
        return includeKeywords ? NONE : omitKeywords();
    }

    final class OmitKeywords implements SubtreeFilter {

        static final OmitKeywords INSTANCE = new OmitKeywords();

        private static final Set<String> BODY_TAGS = Set.of(
                "kw", "for", "while", "iter", "if", "try", "branch", "group", "variable",
                "return", "break", "continue", "error", "msg");
        private static final Set<String> FIXTURE_OWNERS = Set.of("suite", "test");

        private OmitKeywords() {
        }

        @Override
        public boolean suppress(String parentTag, ReportElement element) {
            if (!BODY_TAGS.contains(element.getTag()) || "errors".equals(parentTag)) return false;
            return !(isFixture(element) && FIXTURE_OWNERS.contains(parentTag));
        }

        private static boolean isFixture(ReportElement element) {
            String type = element.get("type");
            return "kw".equals(element.getTag())
                    && ("setup".equalsIgnoreCase(type) || "teardown".equalsIgnoreCase(type));
        }
    }
}
