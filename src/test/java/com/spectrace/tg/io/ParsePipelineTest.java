package com.spectrace.tg.io;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.spectrace.tg.TraceFixtures;
import com.spectrace.tg.api.SourceDomain;
import com.spectrace.tg.io.parsers.RequirementParser;

import org.junit.Test;

import static org.junit.Assert.*;

public class ParsePipelineTest {

    private static final IdPatterns IDS = IdPatterns.of(new TraceConfig());

    private static SourceUnit mixedSpec() {
        return TraceFixtures.spec("spec/mixed.md",
                "# Overview",                               // 1
                "",                                         // 2
                "<!-- # REQ-p00009: Hidden -->",            // 3
                "```",                                      // 4
                "# REQ-p00008: Example only",               // 5
                "```",                                      // 6
                "# REQ-p00001: Real",                       // 7
                "**Level**: PRD | **Status**: Active",      // 8
                "Body text.",                               // 9
                "*End* *Real*",                             // 10
                "trailing words");                          // 11
    }

    @Test
    public void testEveryLineClaimedExactlyOnce() {
        SourceUnit unit = mixedSpec();
        ParsedUnit parsed = ParsePipeline.forDomain(SourceDomain.SPEC, IDS).parse(unit);

        Set<Integer> seen = new HashSet<>();
        for (ContentFragment f : parsed.fragments())
            for (int line : f.lines())
                assertTrue("line " + line + " claimed twice", seen.add(line));
        assertEquals(unit.lineCount(), seen.size());
    }

    @Test
    public void testFragmentTypesInLineOrder() {
        ParsedUnit parsed = ParsePipeline.forDomain(SourceDomain.SPEC, IDS).parse(mixedSpec());

        List<FragmentType> types = new ArrayList<>();
        parsed.fragments().forEach(f -> types.add(f.type()));
        assertEquals(List.of(FragmentType.REMAINDER, FragmentType.COMMENT, FragmentType.FIXTURE,
                FragmentType.REQUIREMENT, FragmentType.REMAINDER), types);

        // Only the live requirement is parsed; the commented and fenced headers are not
        List<ContentFragment> reqs = parsed.fragmentsOfType(FragmentType.REQUIREMENT);
        assertEquals(1, reqs.size());
        assertEquals("REQ-p00001", reqs.get(0).field("id"));
        assertTrue(parsed.warnings().isEmpty());
    }

    @Test
    public void testRemainderRunsAndHeadings() {
        ParsedUnit parsed = ParsePipeline.forDomain(SourceDomain.SPEC, IDS).parse(mixedSpec());
        List<ContentFragment> rem = parsed.fragmentsOfType(FragmentType.REMAINDER);

        assertEquals(2, rem.size());
        assertEquals(List.of(1, 2), rem.get(0).lines());
        assertEquals("section", rem.get(0).field("contentType"));
        assertEquals("Overview", rem.get(0).field("heading"));
        assertEquals(List.of(11), rem.get(1).lines());
        assertEquals("text", rem.get(1).field("contentType"));
        assertNull(rem.get(1).field("heading"));
    }

    @Test
    public void testNonContiguousUnclaimedLinesSplitRemainders() {
        // Line 2 claimed by the comment parser leaves 1 and 3 as separate runs
        SourceUnit unit = TraceFixtures.spec("a.md", "first", "<!-- note -->", "third");
        ParsedUnit parsed = ParsePipeline.forDomain(SourceDomain.SPEC, IDS).parse(unit);

        List<ContentFragment> rem = parsed.fragmentsOfType(FragmentType.REMAINDER);
        assertEquals(2, rem.size());
        assertEquals("first", rem.get(0).rawText());
        assertEquals("third", rem.get(1).rawText());
    }

    @Test
    public void testParsersRunInOrder() {
        LineClaimingParser late = parser(90, "late", List.of());
        LineClaimingParser early = parser(5, "early", List.of());
        ParsePipeline pipeline = new ParsePipeline(List.of(late, new RequirementParser(), early), IDS);

        assertEquals("early", pipeline.parsers().get(0).name());
        assertEquals("requirements", pipeline.parsers().get(1).name());
        assertEquals("late", pipeline.parsers().get(2).name());
    }

    @Test
    public void testOverlappingFragmentDropped() {
        SourceUnit unit = TraceFixtures.spec("a.md", "one", "two", "three");
        LineClaimingParser first = new LineClaimingParser() {
            @Override
            public int order() {
                return 1;
            }

            @Override
            public String name() {
                return "first";
            }

            @Override
            public List<ContentFragment> claim(List<NumberedLine> unclaimed, ParseContext context) {
                return List.of(ContentFragment.builder(FragmentType.COMMENT).line(unclaimed.get(1)).build());
            }
        };
        // Claims line 2 again, which the first parser already took
        LineClaimingParser greedy = parser(2, "greedy", List.of(new NumberedLine(1, "one"),
                new NumberedLine(2, "two"), new NumberedLine(3, "three")));

        ParsedUnit parsed = new ParsePipeline(List.of(first, greedy), IDS).parse(unit);

        assertEquals(1, parsed.fragmentsOfType(FragmentType.COMMENT).size());
        assertTrue(parsed.fragmentsOfType(FragmentType.FIXTURE).isEmpty());
        assertEquals(2, parsed.fragmentsOfType(FragmentType.REMAINDER).size());
        assertEquals(1, parsed.warnings().size());
        assertEquals("greedy", parsed.warnings().get(0).parser());
    }

    @Test
    public void testParserFailureIsolatedToUnit() {
        LineClaimingParser fragile = new LineClaimingParser() {
            @Override
            public int order() {
                return 1;
            }

            @Override
            public String name() {
                return "fragile";
            }

            @Override
            public List<ContentFragment> claim(List<NumberedLine> unclaimed, ParseContext context) {
                if (context.path().equals("bad.md"))
                    throw new IllegalStateException("boom");
                return List.of();
            }
        };
        ParsePipeline pipeline = new ParsePipeline(List.of(fragile), IDS);

        ParsedUnit bad = pipeline.parse(TraceFixtures.spec("bad.md", "text"));
        assertTrue(bad.isFailed());
        assertTrue(bad.fragments().isEmpty());
        assertTrue(bad.failure().contains("fragile"));
        assertTrue(bad.failure().contains("boom"));

        // Other units still parse
        ParsedUnit good = pipeline.parse(TraceFixtures.spec("good.md", "text"));
        assertFalse(good.isFailed());
        assertEquals(1, good.fragmentsOfType(FragmentType.REMAINDER).size());
    }

    @Test
    public void testEmptyUnit() {
        ParsedUnit parsed = ParsePipeline.forDomain(SourceDomain.SPEC, IDS)
                .parse(new SourceUnit("empty.md", SourceDomain.SPEC, List.of()));
        assertFalse(parsed.isFailed());
        assertTrue(parsed.fragments().isEmpty());
        assertEquals(0, parsed.expectedBrokenLinks());
    }

    @Test
    public void testMarkerBudgetCarried() {
        SourceUnit unit = TraceFixtures.spec("a.md", "<!-- spectrace: expected-broken-links 3 -->", "text");
        assertEquals(3, ParsePipeline.forDomain(SourceDomain.SPEC, IDS).parse(unit).expectedBrokenLinks());
    }

    @Test
    public void testOversizedMarkerWarnsAndParses() {
        SourceUnit unit = TraceFixtures.code("src/a.py",
                "# spectrace: expected-broken-links 99999999999",
                "# Implements: REQ-d00001");
        ParsedUnit parsed = ParsePipeline.forDomain(SourceDomain.CODE, IDS).parse(unit);

        assertFalse(parsed.isFailed());
        assertEquals(0, parsed.expectedBrokenLinks());
        assertEquals(1, parsed.warnings().size());
        assertEquals("marker", parsed.warnings().get(0).parser());
        assertTrue(parsed.fragments().stream().anyMatch(f -> f.type() == FragmentType.CODE_REF));
    }

    @Test
    public void testSourceUnitOfNormalizesLineBreaks() {
        SourceUnit unit = SourceUnit.of("a.md", SourceDomain.SPEC, "one\r\ntwo\rthree\n");
        assertEquals(3, unit.lineCount());
        assertEquals("two", unit.line(2));
        assertEquals("md", unit.extension());
        assertEquals("", SourceUnit.of("Makefile", SourceDomain.CODE, "").extension());
    }

    private static LineClaimingParser parser(int order, String name, List<NumberedLine> claim) {
        return new LineClaimingParser() {
            @Override
            public int order() {
                return order;
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public List<ContentFragment> claim(List<NumberedLine> unclaimed, ParseContext context) {
                if (claim.isEmpty())
                    return List.of();
                return List.of(ContentFragment.builder(FragmentType.FIXTURE).lines(claim).build());
            }
        };
    }
}
