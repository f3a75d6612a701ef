package com.runtree.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelJsonTest {

    private static Map<String, Object> sample() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("a", 1);
        data.put("b", List.of(1, 2));
        return data;
    }

    @Test
    void write_defaultIsCompact() {
        assertEquals("{\"a\":1,\"b\":[1,2]}", ModelJson.write(sample(), JsonFormat.DEFAULT));
    }

    @Test
    void write_indentsNestedContainers() {
        String json = ModelJson.write(sample(), JsonFormat.DEFAULT.withIndent(2));
        assertEquals("{\n  \"a\":1,\n  \"b\":[\n    1,\n    2\n  ]\n}", json);
    }

    @Test
    void write_usesCustomSeparators() {
        String json = ModelJson.write(sample(), JsonFormat.DEFAULT.withSeparators(", ", ": "));
        assertEquals("{\"a\": 1, \"b\": [1, 2]}", json);
    }

    @Test
    void write_emptyContainersStayOnOneLine() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("list", List.of());
        data.put("map", Map.of());
        assertEquals("{\n \"list\":[],\n \"map\":{}\n}", ModelJson.write(data, JsonFormat.DEFAULT.withIndent(1)));
    }

    @Test
    void write_ensureAsciiEscapesNonAscii() {
        Map<String, Object> data = Map.of("name", "\u00e4iti");
        assertEquals("{\"name\":\"\u00e4iti\"}", ModelJson.write(data, JsonFormat.DEFAULT));
        String escaped = ModelJson.write(data, JsonFormat.DEFAULT.withEnsureAscii(true));
        assertFalse(escaped.contains("\u00e4"));
        assertEquals("{\"name\":\"\\u00e4iti\"}", escaped.toLowerCase());
    }

    @Test
    void load_preservesKeyOrder() {
        Map<String, Object> data = ModelJson.load("{\"z\": 1, \"a\": 2, \"m\": 3}");
        assertEquals(List.of("z", "a", "m"), List.copyOf(data.keySet()));
    }

    @Test
    void load_rejectsMalformedText() {
        DataException e = assertThrows(DataException.class, () -> ModelJson.load("{\"a\": "));
        assertTrue(e.getMessage().startsWith("Loading JSON data failed: "), e.getMessage());
    }

    @Test
    void load_rejectsNullAndTrailingTokens() {
        assertThrows(DataException.class, () -> ModelJson.load("null"));
        assertThrows(DataException.class, () -> ModelJson.load("{\"a\": 1} {\"b\": 2}"));
        assertThrows(DataException.class, () -> ModelJson.load("[1, 2]"));
    }

    @Test
    void writeAndLoad_path(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("data.json");
        ModelJson.write(sample(), file, JsonFormat.DEFAULT);
        assertEquals("{\"a\":1,\"b\":[1,2]}", Files.readString(file, StandardCharsets.UTF_8));
        assertEquals(sample(), ModelJson.load(file));
    }
}
