package com.spectrace.tg.io;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * The set of lines of one unit already claimed by a parser.
 *
 * Backed by a bit set indexed by line number, so claiming and testing are O(1)
 * and the unclaimed view is a single scan.
 */
final class ClaimedLines {
    private final BitSet claimed;
    private final int lineCount;

    ClaimedLines(int lineCount) {
        this.lineCount = lineCount;
        this.claimed = new BitSet(lineCount + 1);
    }

    /** True if every line is inside the unit and still free. */
    boolean canClaim(List<Integer> lines) {
        for (int line : lines)
            if (line < 1 || line > lineCount || claimed.get(line))
                return false;
        return true;
    }

    void claim(List<Integer> lines) {
        for (int line : lines)
            claimed.set(line);
    }

    int claimedCount() {
        return claimed.cardinality();
    }

    boolean allClaimed() {
        return claimedCount() == lineCount;
    }

    /** Unclaimed lines of the unit, ascending. */
    List<NumberedLine> unclaimed(SourceUnit unit) {
        List<NumberedLine> out = new ArrayList<>(lineCount - claimedCount());
        for (int n = claimed.nextClearBit(1); n <= lineCount; n = claimed.nextClearBit(n + 1))
            out.add(new NumberedLine(n, unit.line(n)));
        return out;
    }
}
