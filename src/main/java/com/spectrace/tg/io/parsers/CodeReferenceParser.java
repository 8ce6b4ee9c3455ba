package com.spectrace.tg.io.parsers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.FragmentType;
import com.spectrace.tg.io.LineClaimingParser;
import com.spectrace.tg.io.NumberedLine;
import com.spectrace.tg.io.ParseContext;

/**
 * Claims requirement reference comments in source code, for example
 * {@code // Implements: REQ-d00001, REQ-d00002-A}. Consecutive reference
 * lines form a single Code node.
 */
public final class CodeReferenceParser implements LineClaimingParser {
    public static final int ORDER = 70;

    static final Pattern REFERENCE = Pattern.compile(
            "^\\s*(?:#+|//+|--|/\\*+|\\*)\\s*(?<kw>Implements|Refines|Validates|Addresses)\\s*:\\s*(?<refs>.+?)\\s*(?:\\*/|-->)?\\s*$",
            Pattern.CASE_INSENSITIVE);

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public String name() {
        return "code-references";
    }

    @Override
    public List<ContentFragment> claim(List<NumberedLine> unclaimed, ParseContext context) {
        List<ContentFragment> out = new ArrayList<>();
        int i = 0;
        while (i < unclaimed.size()) {
            if (!REFERENCE.matcher(unclaimed.get(i).text()).matches()) {
                i++;
                continue;
            }
            int j = i + 1;
            while (j < unclaimed.size() && unclaimed.get(j).number() == unclaimed.get(j - 1).number() + 1
                    && REFERENCE.matcher(unclaimed.get(j).text()).matches())
                j++;

            List<NumberedLine> run = unclaimed.subList(i, j);
            String id = "code:" + context.path() + ":" + run.get(0).number();
            ContentFragment.Builder fragment = ContentFragment.builder(FragmentType.CODE_REF).lines(run)
                    .field("id", id);
            for (NumberedLine line : run) {
                Matcher m = REFERENCE.matcher(line.text());
                if (m.matches())
                    ReferenceLists.addLinks(fragment, id, m.group("refs"), EdgeKind.fromKeyword(m.group("kw")),
                            context.ids(), context.location(line.number()));
            }
            if (!fragment.hasLinks())
                context.warn(name(), run.get(0).number(), "Reference comment names no requirement");
            out.add(fragment.field("text", String.join("\n", run.stream().map(NumberedLine::text).toList())).build());
            i = j;
        }
        return out;
    }
}
