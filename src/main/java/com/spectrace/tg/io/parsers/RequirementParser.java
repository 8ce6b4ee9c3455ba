package com.spectrace.tg.io.parsers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.io.AssertionRecord;
import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.FragmentType;
import com.spectrace.tg.io.IdPatterns;
import com.spectrace.tg.io.LineClaimingParser;
import com.spectrace.tg.io.NumberedLine;
import com.spectrace.tg.io.ParseContext;
import com.spectrace.tg.io.SectionRecord;
import com.spectrace.tg.util.ContentHasher;

/**
 * Parses requirement blocks from spec documents.
 *
 * <pre>
 * # REQ-d00001: Session timeout
 * **Level**: DEV | **Implements**: p00001-A | **Status**: Active
 * Sessions expire after inactivity.
 * ## Assertions
 * A. The system SHALL expire idle sessions after 15 minutes.
 * ## Rationale
 * ...
 * *End* *Session timeout* | **Hash**: 1a2b3c4d
 * </pre>
 *
 * A block runs from its header to the end marker, plus a directly following
 * {@code ---} separator. Without an end marker it stops before the next
 * requirement or journey header and a warning is raised.
 */
public final class RequirementParser implements LineClaimingParser {
    public static final int ORDER = 50;

    static final Pattern END_MARKER = Pattern
            .compile("^\\*End\\*\\s+\\*[^*]+\\*\\s*(?:\\|\\s*\\*\\*Hash\\*\\*\\s*:\\s*(?<hash>\\S+))?");
    private static final Pattern FIELD = Pattern.compile(
            "^\\s*\\**\\s*(?<key>Level|Status|Implements|Refines|Validates|Addresses)\\s*\\**\\s*:\\s*\\**\\s*(?<value>.*?)\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SECTION = Pattern.compile("^##+\\s+(?<heading>.+?)\\s*$");
    private static final Pattern ASSERTION = Pattern.compile("^\\s*(?<label>[A-Za-z0-9]+)\\.\\s+(?<text>.+?)\\s*$");
    private static final Pattern HEX_HASH = Pattern.compile("[0-9a-fA-F]{8}");
    private static final String ASSERTIONS = "Assertions";

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public String name() {
        return "requirements";
    }

    @Override
    public List<ContentFragment> claim(List<NumberedLine> unclaimed, ParseContext context) {
        IdPatterns ids = context.ids();
        List<ContentFragment> out = new ArrayList<>();
        int i = 0;
        while (i < unclaimed.size()) {
            Matcher header = ids.requirementHeader(unclaimed.get(i).text());
            if (!header.matches()) {
                i++;
                continue;
            }
            int footer = -1;
            int stop = unclaimed.size();
            for (int j = i + 1; j < unclaimed.size(); j++) {
                String t = unclaimed.get(j).text();
                if (END_MARKER.matcher(t).find()) {
                    footer = j;
                    break;
                }
                if (ids.requirementHeader(t).matches() || ids.journeyHeader(t).matches()) {
                    stop = j;
                    break;
                }
            }
            int last = footer >= 0 ? footer : stop - 1;
            if (footer < 0) {
                context.warn(name(), unclaimed.get(i).number(),
                        "Requirement " + header.group("id") + " has no end marker");
            } else if (last + 1 < unclaimed.size() && unclaimed.get(last + 1).text().strip().equals("---")
                    && unclaimed.get(last + 1).number() == unclaimed.get(last).number() + 1) {
                last++;
            }
            List<NumberedLine> block = unclaimed.subList(i, last + 1);
            out.add(parseBlock(header.group("id"), header.group("title"), block, footer >= 0 ? footer - i : -1,
                    context));
            i = last + 1;
        }
        return out;
    }

    private ContentFragment parseBlock(String id, String title, List<NumberedLine> block, int footer,
            ParseContext context) {
        IdPatterns ids = context.ids();
        ContentFragment.Builder fragment = ContentFragment.builder(FragmentType.REQUIREMENT).lines(block)
                .field("id", id).field("title", title);

        List<NumberedLine> body = block.subList(1, footer >= 0 ? footer : block.size());
        String bodyText = ContentHasher.trimBlankLines(body.stream().map(NumberedLine::text).toList());

        String level = null;
        String status = null;
        String heading = null;
        List<NumberedLine> section = new ArrayList<>();
        Map<String, AssertionRecord> assertions = new LinkedHashMap<>();

        for (NumberedLine line : body) {
            Matcher s = SECTION.matcher(line.text());
            if (s.matches()) {
                addSection(fragment, heading, section);
                heading = s.group("heading");
                section = new ArrayList<>();
                section.add(line);
                continue;
            }
            if (heading == null) {
                boolean metadata = false;
                for (String part : line.text().split("\\|")) {
                    Matcher f = FIELD.matcher(part);
                    if (!f.matches())
                        continue;
                    metadata = true;
                    String value = f.group("value");
                    switch (f.group("key").toLowerCase(Locale.ROOT)) {
                        case "level" -> level = value;
                        case "status" -> status = value;
                        default -> ReferenceLists.addLinks(fragment, id, value, EdgeKind.fromKeyword(f.group("key")),
                                ids, context.location(line.number()));
                    }
                }
                if (!metadata)
                    section.add(line);
            } else if (heading.equalsIgnoreCase(ASSERTIONS)) {
                parseAssertionLine(line, assertions, id, context);
            } else {
                section.add(line);
            }
        }
        addSection(fragment, heading, section);
        assertions.values().forEach(fragment::assertion);

        String hash = ContentHasher.hash(bodyText);
        if (footer >= 0) {
            Matcher end = END_MARKER.matcher(block.get(footer).text());
            if (end.find() && end.group("hash") != null && HEX_HASH.matcher(end.group("hash")).matches()
                    && ids.config().isVerifyHashes() && !ContentHasher.matches(end.group("hash"), bodyText)) {
                context.warn(name(), block.get(footer).number(), "Hash mismatch for " + id + ": declared "
                        + end.group("hash") + ", computed " + hash);
            }
        }

        String resolvedLevel = level != null ? ids.config().resolveLevel(level) : ids.levelOf(id);
        return fragment.field("level", resolvedLevel)
                .field("status", status != null && !status.isEmpty() ? status : "Unknown")
                .field("body", bodyText)
                .field("hash", hash)
                .build();
    }

    private void parseAssertionLine(NumberedLine line, Map<String, AssertionRecord> assertions, String id,
            ParseContext context) {
        if (line.text().isBlank())
            return;
        Matcher a = ASSERTION.matcher(line.text());
        if (a.matches() && context.ids().isAssertionLabel(a.group("label"))) {
            String label = a.group("label");
            if (assertions.containsKey(label)) {
                context.warn(name(), line.number(), "Duplicate assertion label " + label + " in " + id);
                return;
            }
            assertions.put(label, new AssertionRecord(label, a.group("text"), line.number()));
        } else if (!assertions.isEmpty() && Character.isWhitespace(line.text().charAt(0))) {
            // indented continuation of the previous assertion
            AssertionRecord prev = null;
            for (AssertionRecord r : assertions.values())
                prev = r;
            assertions.put(prev.label(), new AssertionRecord(prev.label(), prev.text() + " " + line.text().strip(),
                    prev.line()));
        } else {
            context.warn(name(), line.number(), "Unrecognised line in assertions of " + id);
        }
    }

    /** Emits a non-empty section. A null heading is the preamble. */
    private static void addSection(ContentFragment.Builder fragment, String heading, List<NumberedLine> lines) {
        if (heading != null && heading.equalsIgnoreCase(ASSERTIONS))
            return;
        List<NumberedLine> content = heading != null ? lines.subList(1, lines.size()) : lines;
        String text = ContentHasher.trimBlankLines(content.stream().map(NumberedLine::text).toList());
        if (text.isEmpty() && heading == null)
            return;
        int first = lines.get(0).number();
        int last = lines.get(lines.size() - 1).number();
        if (heading == null) {
            for (NumberedLine l : lines)
                if (!l.text().isBlank()) {
                    first = l.number();
                    break;
                }
        }
        fragment.section(new SectionRecord(heading != null ? heading : "preamble", text, first, last));
    }
}
