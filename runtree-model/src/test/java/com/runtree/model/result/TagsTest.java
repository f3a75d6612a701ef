package com.runtree.model.result;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TagsTest {

    @Test
    void removeIgnoresCase() {
        Tags tags = Tags.of("t1", "t2");
        tags.remove("T2");
        tags.add("t3");
        assertEquals(List.of("t1", "t3"), tags.asList());
    }

    @Test
    void duplicatesKeepFirstSpelling() {
        Tags tags = Tags.of("Foo Bar", "foo_bar", "FOOBAR");
        assertEquals(List.of("Foo Bar"), tags.asList());
        assertTrue(tags.contains("f o o b a r"));
    }

    @Test
    void iterationIsSortedByNormalizedName() {
        Tags tags = Tags.of("s2", "S1");
        tags.add(List.of("s3", "a"));
        assertEquals(List.of("a", "S1", "s2", "s3"), tags.asList());
    }

    @Test
    void emptyTagsAreIgnored() {
        assertTrue(Tags.of("", " ", "_").isEmpty());
    }

    @Test
    void equalityIgnoresSpelling() {
        assertEquals(Tags.of("Hello World"), Tags.of("hello_world"));
        assertFalse(Tags.of("a").equals(Tags.of("b")));
    }

    @Test
    void coerceAcceptsSingleTagOrSequence() {
        assertEquals(List.of("x"), Tags.coerce("x").asList());
        assertEquals(List.of("x", "y"), Tags.coerce(new String[] {"y", "x"}).asList());
        assertTrue(Tags.coerce(null).isEmpty());
    }

    @Test
    void matchUsesGlobOnNormalizedNames() {
        Tags tags = Tags.of("Smoke Test", "owner-qa");
        assertTrue(tags.match("smoke*"));
        assertTrue(tags.match("OWNER-??"));
        assertTrue(tags.match("smoke_test"));
        assertFalse(tags.match("smoke"));
        assertFalse(tags.match("owner.qa"));
        assertFalse(tags.match(null));
    }
}
