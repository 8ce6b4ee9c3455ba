package com.spectrace.tg.io.parsers;

import java.util.ArrayList;
import java.util.List;

import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.FragmentType;
import com.spectrace.tg.io.LineClaimingParser;
import com.spectrace.tg.io.NumberedLine;
import com.spectrace.tg.io.ParseContext;

/**
 * Claims HTML comment blocks in spec documents before anything else runs, so
 * a requirement header or reference inside a comment is never read as live.
 */
public final class HtmlCommentParser implements LineClaimingParser {
    public static final int ORDER = 0;

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public String name() {
        return "comments";
    }

    @Override
    public List<ContentFragment> claim(List<NumberedLine> unclaimed, ParseContext context) {
        List<ContentFragment> out = new ArrayList<>();
        int i = 0;
        while (i < unclaimed.size()) {
            NumberedLine line = unclaimed.get(i);
            int open = line.text().indexOf("<!--");
            if (open < 0) {
                i++;
                continue;
            }
            if (line.text().indexOf("-->", open + 4) >= 0) {
                out.add(ContentFragment.builder(FragmentType.COMMENT).line(line)
                        .field("commentType", "single_line").build());
                i++;
                continue;
            }
            int j = i + 1;
            while (j < unclaimed.size() && !unclaimed.get(j).text().contains("-->"))
                j++;
            if (j == unclaimed.size()) {
                context.warn(name(), line.number(), "Unterminated HTML comment runs to end of file");
                j--;
            }
            out.add(ContentFragment.builder(FragmentType.COMMENT).lines(unclaimed.subList(i, j + 1))
                    .field("commentType", "multi_line").build());
            i = j + 1;
        }
        return out;
    }
}
