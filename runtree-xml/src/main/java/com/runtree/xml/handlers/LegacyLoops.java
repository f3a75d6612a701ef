package com.runtree.xml.handlers;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers loop data from the names older reports gave to FOR keywords and their iterations:
 * {@code ${x} | ${y} IN ZIP [ @{a} | @{b} ]} and {@code ${x} = 1, ${y} = 2}.
 */
final class LegacyLoops {

    private static final Pattern FOR_NAME =
            Pattern.compile("^(.*?) (IN(?: RANGE| ENUMERATE| ZIP)?) \\[ ?(.*?) ?\\]$");
    private static final Pattern ITERATION_ITEM =
            Pattern.compile("([$@&]\\{.+?\\}) = (.*?)(?=, [$@&]\\{|$)");
    private static final String SEPARATOR = " | ";

    private LegacyLoops() {
    }

    /** {@code assign}, {@code flavor} and {@code values} of a For; empty when the name does not match. */
    static Map<String, Object> forData(String name) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (name == null) return data;
        Matcher matcher = FOR_NAME.matcher(name.trim());
        if (!matcher.matches()) return data;
        data.put("assign", split(matcher.group(1)));
        data.put("flavor", matcher.group(2));
        data.put("values", split(matcher.group(3)));
        return data;
    }

    static Map<String, String> iterationAssign(String name) {
        Map<String, String> assign = new LinkedHashMap<>();
        if (name == null) return assign;
        Matcher matcher = ITERATION_ITEM.matcher(name);
        while (matcher.find()) {
            assign.put(matcher.group(1), matcher.group(2));
        }
        return assign;
    }

    private static List<String> split(String value) {
        if (value.isEmpty()) return List.of();
        return new ArrayList<>(Arrays.asList(value.split(Pattern.quote(SEPARATOR), -1)));
    }
}
