package com.spectrace.tg.io.parsers;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.FragmentType;
import com.spectrace.tg.io.IdPatterns;
import com.spectrace.tg.io.LineClaimingParser;
import com.spectrace.tg.io.NumberedLine;
import com.spectrace.tg.io.ParseContext;

/**
 * Parses user journey blocks.
 *
 * <pre>
 * # JNY-Checkout-01: Guest checkout
 * **Actor**: Guest shopper
 * **Goal**: Buy without creating an account
 * Addresses: REQ-p00001, REQ-p00002
 * *End* *JNY-Checkout-01*
 * </pre>
 */
public final class JourneyParser implements LineClaimingParser {
    public static final int ORDER = 60;

    private static final Pattern FIELD = Pattern.compile(
            "^\\s*\\**\\s*(?<key>Actor|Goal|Addresses)\\s*\\**\\s*:\\s*\\**\\s*(?<value>.*?)\\s*$",
            Pattern.CASE_INSENSITIVE);

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public String name() {
        return "journeys";
    }

    @Override
    public List<ContentFragment> claim(List<NumberedLine> unclaimed, ParseContext context) {
        IdPatterns ids = context.ids();
        List<ContentFragment> out = new ArrayList<>();
        int i = 0;
        while (i < unclaimed.size()) {
            Matcher header = ids.journeyHeader(unclaimed.get(i).text());
            if (!header.matches()) {
                i++;
                continue;
            }
            String id = header.group("id");
            int last = unclaimed.size() - 1;
            boolean ended = false;
            for (int j = i + 1; j < unclaimed.size(); j++) {
                String t = unclaimed.get(j).text();
                if (RequirementParser.END_MARKER.matcher(t).find()) {
                    last = j;
                    ended = true;
                    break;
                }
                if (ids.journeyHeader(t).matches() || ids.requirementHeader(t).matches()) {
                    last = j - 1;
                    break;
                }
            }
            if (!ended)
                context.warn(name(), unclaimed.get(i).number(), "Journey " + id + " has no end marker");

            List<NumberedLine> block = unclaimed.subList(i, last + 1);
            ContentFragment.Builder fragment = ContentFragment.builder(FragmentType.JOURNEY).lines(block)
                    .field("id", id).field("title", header.group("title"));
            for (NumberedLine line : block.subList(1, block.size())) {
                Matcher f = FIELD.matcher(line.text());
                if (!f.matches())
                    continue;
                switch (f.group("key").toLowerCase(Locale.ROOT)) {
                    case "actor" -> fragment.field("actor", f.group("value"));
                    case "goal" -> fragment.field("goal", f.group("value"));
                    default -> ReferenceLists.addLinks(fragment, id, f.group("value"), EdgeKind.ADDRESSES, ids,
                            context.location(line.number()));
                }
            }
            out.add(fragment.build());
            i = last + 1;
        }
        return out;
    }
}
