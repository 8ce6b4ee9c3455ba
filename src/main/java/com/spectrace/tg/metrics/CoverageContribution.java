package com.spectrace.tg.metrics;

/** One node's contribution to the coverage of an assertion. */
public record CoverageContribution(String sourceId, CoverageTier tier) {
}
