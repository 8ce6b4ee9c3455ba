package com.spectrace.tg.io;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.spectrace.tg.api.SourceDomain;
import com.spectrace.tg.io.parsers.CodeReferenceParser;
import com.spectrace.tg.io.parsers.FixtureBlockParser;
import com.spectrace.tg.io.parsers.HtmlCommentParser;
import com.spectrace.tg.io.parsers.JUnitXmlResultParser;
import com.spectrace.tg.io.parsers.JourneyParser;
import com.spectrace.tg.io.parsers.JsonResultParser;
import com.spectrace.tg.io.parsers.RequirementParser;
import com.spectrace.tg.io.parsers.TestReferenceParser;

import lombok.extern.log4j.Log4j2;

/**
 * Runs an ordered set of {@link LineClaimingParser}s over one source unit.
 *
 * <ol>
 * <li>Parsers run in ascending {@link LineClaimingParser#order()}, each seeing
 * only lines that are still unclaimed.</li>
 * <li>A fragment is accepted only if every line it names is still free; the
 * accepted lines are then claimed.</li>
 * <li>Lines no parser claimed are folded into one Remainder fragment per
 * maximal run of consecutive line numbers.</li>
 * </ol>
 *
 * A parser that throws aborts its unit only: the unit comes back with
 * {@link ParsedUnit#failure()} set and no fragments.
 *
 * The pipeline holds no per-unit state, so independent units may be parsed
 * on different threads.
 */
@Log4j2
public final class ParsePipeline {
    private final List<LineClaimingParser> parsers;
    private final IdPatterns ids;

    public ParsePipeline(List<? extends LineClaimingParser> parsers, IdPatterns ids) {
        List<LineClaimingParser> sorted = new ArrayList<>(parsers);
        sorted.sort(Comparator.comparingInt(LineClaimingParser::order));
        this.parsers = List.copyOf(sorted);
        this.ids = ids;
    }

    /** The standard parser set for a source domain. */
    public static ParsePipeline forDomain(SourceDomain domain, IdPatterns ids) {
        List<LineClaimingParser> set = switch (domain) {
            case SPEC -> List.of(new HtmlCommentParser(), new FixtureBlockParser(), new RequirementParser(),
                    new JourneyParser());
            case CODE -> List.of(new FixtureBlockParser(), new CodeReferenceParser());
            case TEST -> List.of(new FixtureBlockParser(), new TestReferenceParser());
            case RESULT -> List.of(new JUnitXmlResultParser(), new JsonResultParser());
        };
        return new ParsePipeline(set, ids);
    }

    public List<LineClaimingParser> parsers() {
        return parsers;
    }

    public ParsedUnit parse(SourceUnit unit) {
        ParseContext context = new ParseContext(unit, ids);
        ClaimedLines claimed = new ClaimedLines(unit.lineCount());
        List<ContentFragment> fragments = new ArrayList<>();

        for (LineClaimingParser parser : parsers) {
            if (claimed.allClaimed())
                break;
            List<ContentFragment> produced;
            try {
                produced = parser.claim(claimed.unclaimed(unit), context);
            } catch (RuntimeException e) {
                log.warn("Parser {} failed on {}", parser.name(), unit.path(), e);
                return ParsedUnit.failed(unit, context.warnings(),
                        parser.name() + ": " + e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            for (ContentFragment fragment : produced) {
                if (!claimed.canClaim(fragment.lines())) {
                    context.warn(parser.name(), fragment.startLine(),
                            "Dropped " + fragment.type() + " fragment claiming lines already taken");
                    continue;
                }
                claimed.claim(fragment.lines());
                fragments.add(fragment);
            }
        }

        fragments.addAll(remainders(claimed.unclaimed(unit)));
        fragments.sort(Comparator.comparingInt(ContentFragment::startLine));

        int budget = ExpectedBrokenLinksMarker.find(unit, ids.config().getMarkerHeaderLines(), context);
        log.debug("Parsed {}: {} fragments, {} warnings", unit.path(), fragments.size(), context.warnings().size());
        return new ParsedUnit(unit, fragments, context.warnings(), budget, null);
    }

    private static List<ContentFragment> remainders(List<NumberedLine> unclaimed) {
        List<ContentFragment> out = new ArrayList<>();
        int i = 0;
        while (i < unclaimed.size()) {
            int j = i + 1;
            while (j < unclaimed.size() && unclaimed.get(j).number() == unclaimed.get(j - 1).number() + 1)
                j++;
            List<NumberedLine> run = unclaimed.subList(i, j);
            ContentFragment.Builder b = ContentFragment.builder(FragmentType.REMAINDER).lines(run);
            String heading = headingOf(run);
            b.field("contentType", heading != null ? "section" : "text").field("heading", heading);
            out.add(b.build());
            i = j;
        }
        return out;
    }

    private static String headingOf(List<NumberedLine> run) {
        for (NumberedLine line : run) {
            String t = line.text().strip();
            if (t.isEmpty())
                continue;
            return t.startsWith("#") ? t.replaceFirst("^#+\\s*", "") : null;
        }
        return null;
    }
}
