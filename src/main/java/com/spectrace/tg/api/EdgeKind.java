package com.spectrace.tg.api;

import java.util.Locale;

/**
 * Relationship kinds between graph nodes.
 *
 * Edges always point from the parent (the referenced node) to the child (the
 * node that declared the reference, or a lexical child for CONTAINS).
 */
public enum EdgeKind {
    /** Child claims to satisfy the parent. Contributes to coverage. */
    IMPLEMENTS,
    /** Child adds detail without claiming satisfaction. Never contributes to coverage. */
    REFINES,
    /** Test exercises the parent requirement or one of its assertions. */
    VALIDATES,
    /** Informational link between requirements and user journeys. */
    ADDRESSES,
    /** Structural parent to lexical child. Created only by the graph builder. */
    CONTAINS;

    public boolean contributesToCoverage() {
        return this == IMPLEMENTS || this == VALIDATES;
    }

    /** Edges that carry hierarchy authority; the only ones that can form cycles. */
    public boolean isAuthority() {
        return this == IMPLEMENTS || this == REFINES;
    }

    /** Parses a keyword such as "Implements" or "validates". */
    public static EdgeKind fromKeyword(String keyword) {
        return valueOf(keyword.trim().toUpperCase(Locale.ROOT));
    }
}
