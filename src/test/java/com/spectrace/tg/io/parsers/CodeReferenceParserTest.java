package com.spectrace.tg.io.parsers;

import java.util.List;

import com.spectrace.tg.TraceFixtures;
import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.FragmentType;
import com.spectrace.tg.io.ParsedUnit;

import org.junit.Test;

import static org.junit.Assert.*;

public class CodeReferenceParserTest {

    @Test
    public void testConsecutiveLinesFormOneNode() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.code("src/Auth.java",
                "package auth;",
                "",
                "// Implements: REQ-d00001",
                "// Implements: REQ-d00002-A, REQ-d00003",
                "public class Auth {",
                "    /* Implements: REQ-d00004 */",
                "}"));

        List<ContentFragment> refs = parsed.fragmentsOfType(FragmentType.CODE_REF);
        assertEquals(2, refs.size());

        ContentFragment first = refs.get(0);
        assertEquals("code:src/Auth.java:3", first.field("id"));
        assertEquals(List.of(3, 4), first.lines());
        assertEquals(3, first.links().size());
        assertEquals(List.of("A"), first.links().get(1).assertionLabels());
        assertEquals(4, first.links().get(2).location().line());

        ContentFragment second = refs.get(1);
        assertEquals("code:src/Auth.java:6", second.field("id"));
        assertEquals("REQ-d00004", second.links().get(0).target());
    }

    @Test
    public void testKeywordsAndCommentStyles() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.code("db/schema.sql",
                "-- Refines: REQ-d00001",
                "",
                "# IMPLEMENTS: d00002"));
        List<ContentFragment> refs = parsed.fragmentsOfType(FragmentType.CODE_REF);
        assertEquals(2, refs.size());
        assertEquals(EdgeKind.REFINES, refs.get(0).links().get(0).kind());
        assertEquals("REQ-d00002", refs.get(1).links().get(0).target());
    }

    @Test
    public void testEmptyReferenceWarns() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.code("a.py", "# Implements: -"));
        assertEquals(1, parsed.fragmentsOfType(FragmentType.CODE_REF).size());
        assertTrue(parsed.fragmentsOfType(FragmentType.CODE_REF).get(0).links().isEmpty());
        assertEquals(1, parsed.warnings().size());
    }

    @Test
    public void testPlainCodeUnclaimed() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.code("a.py",
                "x = 'Implements: REQ-d00001'",
                "print(x)"));
        assertTrue(parsed.fragmentsOfType(FragmentType.CODE_REF).isEmpty());
        assertEquals(1, parsed.fragments().size());
    }
}
