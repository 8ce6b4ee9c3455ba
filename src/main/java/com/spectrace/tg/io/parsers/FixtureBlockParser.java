package com.spectrace.tg.io.parsers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.spectrace.tg.api.SourceDomain;
import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.FragmentType;
import com.spectrace.tg.io.LineClaimingParser;
import com.spectrace.tg.io.NumberedLine;
import com.spectrace.tg.io.ParseContext;

/**
 * Claims example and mock-data blocks so their contents never become live
 * requirements or references.
 *
 * <ul>
 * <li>Spec documents: every fenced block ({@code ```} or {@code ~~~}).</li>
 * <li>Code and test files: multi-line string assignments (Python triple
 * quotes, Java text blocks) and shell heredocs, but only when the block
 * mentions a requirement id.</li>
 * </ul>
 */
public final class FixtureBlockParser implements LineClaimingParser {
    public static final int ORDER = 10;

    private static final Pattern FENCE = Pattern.compile("^\\s*(?<fence>`{3,}|~{3,})");
    private static final Pattern TRIPLE_QUOTE = Pattern.compile("=\\s*[fFrRbBuU]{0,2}(?<quote>\"\"\"|''')(?<rest>.*)$");
    private static final Pattern HEREDOC = Pattern.compile("<<-?\\s*['\"]?(?<tag>[A-Za-z_][A-Za-z0-9_]*)['\"]?");

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public String name() {
        return "fixtures";
    }

    @Override
    public List<ContentFragment> claim(List<NumberedLine> unclaimed, ParseContext context) {
        return context.domain() == SourceDomain.SPEC ? fences(unclaimed, context) : embedded(unclaimed, context);
    }

    private List<ContentFragment> fences(List<NumberedLine> lines, ParseContext context) {
        List<ContentFragment> out = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            Matcher m = FENCE.matcher(lines.get(i).text());
            if (!m.find()) {
                i++;
                continue;
            }
            String fence = m.group("fence");
            int close = -1;
            for (int j = i + 1; j < lines.size(); j++) {
                String t = lines.get(j).text().strip();
                if (t.startsWith(fence) && t.chars().allMatch(c -> c == fence.charAt(0))) {
                    close = j;
                    break;
                }
            }
            if (close < 0) {
                context.warn(name(), lines.get(i).number(), "Unterminated fenced block left unclaimed");
                i++;
                continue;
            }
            out.add(ContentFragment.builder(FragmentType.FIXTURE).lines(lines.subList(i, close + 1))
                    .field("blockType", "fence").build());
            i = close + 1;
        }
        return out;
    }

    private List<ContentFragment> embedded(List<NumberedLine> lines, ParseContext context) {
        List<ContentFragment> out = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            String text = lines.get(i).text();
            int close = -1;
            String blockType = null;

            Matcher q = TRIPLE_QUOTE.matcher(text);
            Matcher h = HEREDOC.matcher(text);
            if (q.find() && !q.group("rest").contains(q.group("quote"))) {
                close = findLine(lines, i + 1, q.group("quote"), false);
                blockType = "triple_quote";
            } else if (h.find()) {
                close = findLine(lines, i + 1, h.group("tag"), true);
                blockType = "heredoc";
            }
            if (blockType == null) {
                i++;
                continue;
            }
            if (close < 0) {
                context.warn(name(), lines.get(i).number(), "Unterminated " + blockType + " block left unclaimed");
                i++;
                continue;
            }
            List<NumberedLine> block = lines.subList(i, close + 1);
            if (block.stream().anyMatch(l -> context.ids().mentionsRequirement(l.text()))) {
                out.add(ContentFragment.builder(FragmentType.FIXTURE).lines(block).field("blockType", blockType)
                        .build());
                i = close + 1;
            } else {
                i++;
            }
        }
        return out;
    }

    private static int findLine(List<NumberedLine> lines, int from, String terminator, boolean exact) {
        for (int j = from; j < lines.size(); j++) {
            String t = lines.get(j).text();
            if (exact ? t.strip().equals(terminator) : t.contains(terminator))
                return j;
        }
        return -1;
    }
}
