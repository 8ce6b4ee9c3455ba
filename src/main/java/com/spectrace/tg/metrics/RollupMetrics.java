package com.spectrace.tg.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Aggregate coverage and test counters for one node.
 *
 * Always produced whole by {@link CoverageAnnotator}; never patched. Read-only
 * outside this package.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@EqualsAndHashCode
@ToString
public final class RollupMetrics {
    private int totalAssertions;
    private int coveredAssertions;
    private int directCovered;
    private int explicitCovered;
    private int inferredCovered;
    private int indirectCovered;

    private int totalTests;
    private int passedTests;
    private int failedTests;
    private int skippedTests;

    private int totalCodeRefs;

    private double coveragePct;
    private double indirectCoveragePct;
    private double passRatePct;
    private boolean hasFailures;

    /** Assertion label to the contributions made to it, strongest first. */
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final Map<String, List<CoverageContribution>> contributions = new LinkedHashMap<>();

    public Map<String, List<CoverageContribution>> getContributions() {
        return Collections.unmodifiableMap(contributions);
    }

    void putContributions(String label, List<CoverageContribution> ranked) {
        contributions.put(label, List.copyOf(ranked));
    }

    /** Counts one assertion at its strongest tier, or uncovered when tier is null. */
    void countAssertion(CoverageTier tier) {
        totalAssertions++;
        if (tier == null)
            return;
        switch (tier) {
            case DIRECT -> directCovered++;
            case EXPLICIT -> explicitCovered++;
            case INFERRED -> inferredCovered++;
            case INDIRECT -> indirectCovered++;
        }
        if (tier != CoverageTier.INDIRECT)
            coveredAssertions++;
    }

    void derivePercentages() {
        coveragePct = totalAssertions == 0 ? 0.0 : 100.0 * coveredAssertions / totalAssertions;
        indirectCoveragePct = totalAssertions == 0 ? 0.0
                : 100.0 * (coveredAssertions + indirectCovered) / totalAssertions;
        int executed = passedTests + failedTests;
        passRatePct = executed == 0 ? 0.0 : 100.0 * passedTests / executed;
        hasFailures = failedTests > 0;
    }
}
