package com.runtree.xml.handlers;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LegacyLoopsTest {

    @Test
    void forData_range() {
        Map<String, Object> data = LegacyLoops.forData("${i} IN RANGE [ 10 ]");
        assertEquals(List.of("${i}"), data.get("assign"));
        assertEquals("IN RANGE", data.get("flavor"));
        assertEquals(List.of("10"), data.get("values"));
    }

    @Test
    void forData_severalVariablesAndValues() {
        Map<String, Object> data = LegacyLoops.forData("${index} | ${item} IN ENUMERATE [ a | b c | @{rest} ]");
        assertEquals(List.of("${index}", "${item}"), data.get("assign"));
        assertEquals("IN ENUMERATE", data.get("flavor"));
        assertEquals(List.of("a", "b c", "@{rest}"), data.get("values"));
    }

    @Test
    void forData_noValues() {
        assertEquals(List.of(), LegacyLoops.forData("${x} IN [ ]").get("values"));
    }

    @Test
    void forData_unrecognizedNameGivesNothing() {
        assertTrue(LegacyLoops.forData("Some keyword").isEmpty());
        assertTrue(LegacyLoops.forData(null).isEmpty());
    }

    @Test
    void iterationAssign_keepsOrderAndCommasInValues() {
        Map<String, String> assign = LegacyLoops.iterationAssign("${b} = 1, 2, ${a} = x");
        assertEquals(List.of("${b}", "${a}"), List.copyOf(assign.keySet()));
        assertEquals("1, 2", assign.get("${b}"));
        assertEquals("x", assign.get("${a}"));
    }
}
