package com.spectrace.tg.io;

import java.util.List;

/**
 * A parser plugin in the claim pipeline.
 *
 * Parsers run in ascending {@link #order()}: a lower value is a higher
 * priority and sees the text first. Each parser receives only the lines no
 * earlier parser claimed, in line order, and returns one fragment per piece of
 * content it recognises. A parser must not claim the same line twice; the
 * pipeline drops any fragment that does.
 *
 * Parsers are stateless and may be shared between units.
 */
public interface LineClaimingParser {

    /** Position in the pipeline. Lower runs first. */
    int order();

    /** Short name used in warnings and logs. */
    String name();

    /**
     * Claims and parses lines.
     *
     * @param unclaimed lines still available, ascending by line number; not necessarily contiguous
     * @param context   unit context and warning sink
     * @return fragments for the claimed content, possibly empty
     */
    List<ContentFragment> claim(List<NumberedLine> unclaimed, ParseContext context);
}
