package com.spectrace.tg.io;

import java.util.List;

import org.junit.Test;

import static org.junit.Assert.*;

public class IdPatternsTest {

    private final IdPatterns ids = IdPatterns.of(new TraceConfig());

    @Test
    public void testRequirementIds() {
        assertTrue(ids.isRequirementId("REQ-p00001"));
        assertTrue(ids.isRequirementId("REQ-CAL-d00001"));
        assertFalse(ids.isRequirementId("REQ-p001"));
        assertFalse(ids.isRequirementId("REQ-p00001-A"));
        assertTrue(ids.isJourneyId("JNY-Login-01"));
    }

    @Test
    public void testHeaders() {
        assertTrue(ids.requirementHeader("# REQ-p00001: User login").matches());
        assertTrue(ids.requirementHeader("### REQ-d00001: Deep").matches());
        assertFalse(ids.requirementHeader("REQ-p00001: no hash").matches());
        assertTrue(ids.journeyHeader("## JNY-Checkout-02: Guest checkout").matches());
    }

    @Test
    public void testQualify() {
        assertEquals("REQ-p00001", ids.qualify("p00001"));
        assertEquals("REQ-p00001", ids.qualify(" REQ-p00001 "));
        assertEquals("req_p00001", ids.qualify("req_p00001"));
        assertEquals("JNY-Login-01", ids.qualify("JNY-Login-01"));
    }

    @Test
    public void testSplitSuffixed() {
        assertEquals(List.of("REQ-p00001", "A", "B", "C"), ids.splitSuffixed("REQ-p00001-A-B-C"));
        assertEquals(List.of("REQ-p00001", "A"), ids.splitSuffixed("REQ-p00001-a"));
        assertEquals(List.of("REQ-p00001", "12"), ids.splitSuffixed("REQ-p00001-12"));
        assertEquals(List.of("REQ-p00001"), ids.splitSuffixed("REQ-p00001"));
        assertEquals(List.of("JNY-Login-01"), ids.splitSuffixed("JNY-Login-01"));
    }

    @Test
    public void testReferencesInName() {
        assertEquals(List.of("REQ-p00001-A"), ids.referencesInName("test_login_REQ_p00001_A"));
        assertEquals(List.of("REQ-d00002"), ids.referencesInName("test_REQ_d00002_reset"));
        assertEquals(List.of("REQ-p00001", "REQ-d00003-B"),
                ids.referencesInName("test_REQ_p00001_and_REQ_d00003_B"));
        assertTrue(ids.referencesInName("test_plain").isEmpty());
    }

    @Test
    public void testLevelOf() {
        assertEquals("PRD", ids.levelOf("REQ-p00001"));
        assertEquals("DEV", ids.levelOf("REQ-CAL-d00001"));
        assertNull(ids.levelOf("REQ-x00001"));
    }

    @Test
    public void testMentionsRequirement() {
        assertTrue(ids.mentionsRequirement("see REQ-d00001"));
        assertTrue(ids.mentionsRequirement("test_req_p00001"));
        assertFalse(ids.mentionsRequirement("REQUEST handling"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidGrammar() {
        TraceConfig config = new TraceConfig();
        config.getIds().setPattern("REQ-([");
        IdPatterns.of(config);
    }
}
