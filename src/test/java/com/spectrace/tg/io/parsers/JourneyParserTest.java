package com.spectrace.tg.io.parsers;

import java.util.List;

import com.spectrace.tg.TraceFixtures;
import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.FragmentType;
import com.spectrace.tg.io.ParsedUnit;

import org.junit.Test;

import static org.junit.Assert.*;

public class JourneyParserTest {

    @Test
    public void testJourneyFields() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.spec("spec/journeys.md",
                "# JNY-Checkout-01: Guest checkout",
                "**Actor**: Guest shopper",
                "**Goal**: Buy without an account",
                "Addresses: REQ-p00001, REQ-p00002",
                "*End* *JNY-Checkout-01*"));

        List<ContentFragment> journeys = parsed.fragmentsOfType(FragmentType.JOURNEY);
        assertEquals(1, journeys.size());
        ContentFragment j = journeys.get(0);
        assertEquals("JNY-Checkout-01", j.field("id"));
        assertEquals("Guest checkout", j.field("title"));
        assertEquals("Guest shopper", j.field("actor"));
        assertEquals("Buy without an account", j.field("goal"));
        assertEquals(2, j.links().size());
        assertEquals(EdgeKind.ADDRESSES, j.links().get(1).kind());
        assertEquals("REQ-p00002", j.links().get(1).target());
        assertTrue(parsed.warnings().isEmpty());
    }

    @Test
    public void testUnterminatedJourneyWarns() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.spec("a.md",
                "# JNY-A-01: First",
                "**Actor**: Someone",
                "# JNY-A-02: Second",
                "*End* *JNY-A-02*"));
        List<ContentFragment> journeys = parsed.fragmentsOfType(FragmentType.JOURNEY);
        assertEquals(2, journeys.size());
        assertEquals(List.of(1, 2), journeys.get(0).lines());
        assertEquals(1, parsed.warnings().size());
    }
}
