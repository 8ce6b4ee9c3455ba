package com.spectrace.tg.util;

import java.util.List;

import org.junit.Test;

import static org.junit.Assert.*;

public class ContentHasherTest {

    @Test
    public void testKnownDigests() {
        assertEquals("e3b0c442", ContentHasher.hash(""));
        assertEquals("ba7816bf", ContentHasher.hash("abc"));
        assertEquals(ContentHasher.LENGTH, ContentHasher.hash("anything at all").length());
    }

    @Test
    public void testTrimBlankLines() {
        assertEquals("one\n\ntwo", ContentHasher.trimBlankLines(List.of("", "  ", "one", "", "two", "\t", "")));
        assertEquals("", ContentHasher.trimBlankLines(List.of("", " ")));
        assertEquals("", ContentHasher.trimBlankLines(List.of()));
        // Inner indentation is kept
        assertEquals("  a\nb  ", ContentHasher.trimBlankLines(List.of("  a", "b  ")));
    }

    @Test
    public void testMatches() {
        assertTrue(ContentHasher.matches("ba7816bf", "abc"));
        assertTrue(ContentHasher.matches("BA7816BF", "abc"));
        assertFalse(ContentHasher.matches("ba7816bf", "abd"));
        assertFalse(ContentHasher.matches(null, "abc"));
    }
}
