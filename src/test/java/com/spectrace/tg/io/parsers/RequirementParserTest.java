package com.spectrace.tg.io.parsers;

import java.util.List;

import com.spectrace.tg.TraceFixtures;
import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.io.AssertionRecord;
import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.FragmentType;
import com.spectrace.tg.io.ParsedUnit;
import com.spectrace.tg.io.PendingLink;
import com.spectrace.tg.io.SectionRecord;
import com.spectrace.tg.io.TraceConfig;
import com.spectrace.tg.util.ContentHasher;

import org.junit.Test;

import static org.junit.Assert.*;

public class RequirementParserTest {

    private static ContentFragment only(ParsedUnit parsed) {
        List<ContentFragment> reqs = parsed.fragmentsOfType(FragmentType.REQUIREMENT);
        assertEquals(1, reqs.size());
        return reqs.get(0);
    }

    @Test
    public void testFullBlock() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.spec("spec/dev.md",
                "# REQ-d00001: Session timeout",                                              // 1
                "**Level**: DEV | **Implements**: p00001-A-B-C, REQ-o00002 | **Status**: Active", // 2
                "",                                                                           // 3
                "Sessions expire after inactivity.",                                          // 4
                "",                                                                           // 5
                "## Assertions",                                                              // 6
                "A. The system SHALL expire idle sessions.",                                  // 7
                "B. The system SHALL warn before expiry",                                     // 8
                "   with a countdown.",                                                       // 9
                "",                                                                           // 10
                "## Rationale",                                                               // 11
                "Shared terminals.",                                                          // 12
                "*End* *Session timeout*",                                                    // 13
                "---"));                                                                      // 14

        ContentFragment req = only(parsed);
        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14), req.lines());
        assertEquals("REQ-d00001", req.field("id"));
        assertEquals("Session timeout", req.field("title"));
        assertEquals("DEV", req.field("level"));
        assertEquals("Active", req.field("status"));
        assertTrue(parsed.fragmentsOfType(FragmentType.REMAINDER).isEmpty());
        assertTrue(parsed.warnings().isEmpty());

        List<AssertionRecord> assertions = req.assertions();
        assertEquals(2, assertions.size());
        assertEquals("A", assertions.get(0).label());
        assertEquals(7, assertions.get(0).line());
        // Indented line continues the previous assertion
        assertEquals("The system SHALL warn before expiry with a countdown.", assertions.get(1).text());

        List<SectionRecord> sections = req.sections();
        assertEquals(2, sections.size());
        assertEquals("preamble", sections.get(0).heading());
        assertEquals("Sessions expire after inactivity.", sections.get(0).content());
        assertEquals(4, sections.get(0).line());
        assertEquals("Rationale", sections.get(1).heading());
        assertEquals("Shared terminals.", sections.get(1).content());

        List<PendingLink> links = req.links();
        assertEquals(2, links.size());
        assertEquals("REQ-p00001", links.get(0).target());
        assertEquals(List.of("A", "B", "C"), links.get(0).assertionLabels());
        assertEquals(EdgeKind.IMPLEMENTS, links.get(0).kind());
        assertEquals("REQ-o00002", links.get(1).target());
        assertTrue(links.get(1).assertionLabels().isEmpty());
        assertEquals(2, links.get(1).location().line());
    }

    @Test
    public void testDefaultsFromId() {
        ContentFragment req = only(TraceFixtures.parse(TraceFixtures.spec("a.md",
                "# REQ-o00003: Backups",
                "Nightly.",
                "*End* *Backups*")));
        assertEquals("OPS", req.field("level"));
        assertEquals("Unknown", req.field("status"));
        assertEquals("Nightly.", req.field("body"));
        assertEquals(ContentHasher.hash("Nightly."), req.field("hash"));
        assertTrue(req.links().isEmpty());
    }

    @Test
    public void testRefinesAndPlaceholderReferences() {
        ContentFragment req = only(TraceFixtures.parse(TraceFixtures.spec("a.md",
                "# REQ-d00004: Detail",
                "**Implements**: - | **Refines**: REQ-d00001",
                "*End* *Detail*")));
        assertEquals(1, req.links().size());
        assertEquals(EdgeKind.REFINES, req.links().get(0).kind());
    }

    @Test
    public void testMissingEndMarkerStopsAtNextHeader() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.spec("a.md",
                "# REQ-p00001: First",
                "No footer here.",
                "# REQ-p00002: Second",
                "*End* *Second*"));

        List<ContentFragment> reqs = parsed.fragmentsOfType(FragmentType.REQUIREMENT);
        assertEquals(2, reqs.size());
        assertEquals(List.of(1, 2), reqs.get(0).lines());
        assertEquals(List.of(3, 4), reqs.get(1).lines());
        assertEquals(1, parsed.warnings().size());
        assertTrue(parsed.warnings().get(0).message().contains("no end marker"));
    }

    @Test
    public void testHashMismatchWarns() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.spec("a.md",
                "# REQ-p00001: First",
                "Body.",
                "*End* *First* | **Hash**: 00000000"));
        assertEquals(1, parsed.warnings().size());
        assertTrue(parsed.warnings().get(0).message().startsWith("Hash mismatch"));
        assertEquals(3, parsed.warnings().get(0).location().line());

        ParsedUnit matching = TraceFixtures.parse(TraceFixtures.spec("a.md",
                "# REQ-p00001: First",
                "Body.",
                "*End* *First* | **Hash**: " + ContentHasher.hash("Body.")));
        assertTrue(matching.warnings().isEmpty());

        TraceConfig lenient = new TraceConfig();
        lenient.setVerifyHashes(false);
        ParsedUnit unchecked = TraceFixtures.parse(TraceFixtures.spec("a.md",
                "# REQ-p00001: First",
                "Body.",
                "*End* *First* | **Hash**: 00000000"), lenient);
        assertTrue(unchecked.warnings().isEmpty());
    }

    @Test
    public void testBadAssertionLines() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.spec("a.md",
                "# REQ-p00001: First",
                "## Assertions",
                "A. One.",
                "A. Again.",
                "Not an assertion",
                "*End* *First*"));

        ContentFragment req = only(parsed);
        assertEquals(1, req.assertions().size());
        assertEquals("One.", req.assertions().get(0).text());
        assertEquals(2, parsed.warnings().size());
        assertTrue(parsed.warnings().get(0).message().contains("Duplicate assertion label A"));
        assertTrue(parsed.warnings().get(1).message().contains("Unrecognised line"));
    }

    @Test
    public void testSeparatorNotClaimedWithoutEndMarker() {
        ParsedUnit parsed = TraceFixtures.parse(TraceFixtures.spec("a.md",
                "# REQ-p00001: First",
                "Body.",
                "# JNY-Login-01: Journey",
                "*End* *JNY-Login-01*"));
        assertEquals(List.of(1, 2), only(parsed).lines());
        assertEquals(1, parsed.fragmentsOfType(FragmentType.JOURNEY).size());
    }
}
