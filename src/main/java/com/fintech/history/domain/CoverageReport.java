package com.fintech.history.domain;

import java.util.List;

/**
 * Data inventory for one symbol and granularity over a requested range.
 *
 * @param covered merged intervals the catalog holds shards for, clipped to the range
 * @param gaps parts of the range no shard covers
 */
public record CoverageReport(
    Category category,
    String symbol,
    Granularity granularity,
    TimeRange range,
    List<TimeRange> covered,
    List<TimeRange> gaps
) {

    public CoverageReport {
        covered = List.copyOf(covered);
        gaps = List.copyOf(gaps);
    }

    public boolean complete() {
        return gaps.isEmpty();
    }
}
