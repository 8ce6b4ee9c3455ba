package com.spectrace.tg.metrics;

/**
 * Confidence of an assertion's coverage, strongest first.
 */
public enum CoverageTier {
    /** A test validates the assertion, or code implements it specifically. */
    DIRECT,
    /** A child requirement implements the specific assertion. */
    EXPLICIT,
    /** A child requirement implements the whole parent. Counted only in strict mode. */
    INFERRED,
    /** A test validates the whole parent requirement. Tracked apart from strict coverage. */
    INDIRECT;

    public boolean isStrongerThan(CoverageTier other) {
        return other == null || ordinal() < other.ordinal();
    }
}
