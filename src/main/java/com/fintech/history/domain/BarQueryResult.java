package com.fintech.history.domain;

import java.util.List;

/**
 * Ordered bars for one logical query plus coverage metadata.
 *
 * @param category queried category
 * @param symbol queried symbol
 * @param range requested half-open range
 * @param granularity requested bar width
 * @param sourceGranularity finest native width the bars were read at (equal to granularity unless rolled up)
 * @param bars bars in non-decreasing timestamp order
 * @param partialCoverage true when at least one required shard could not be read
 * @param shards ids of shards that contributed rows
 * @param unavailableShards ids of shards that were skipped
 */
public record BarQueryResult(
    Category category,
    String symbol,
    TimeRange range,
    Granularity granularity,
    Granularity sourceGranularity,
    List<Bar> bars,
    boolean partialCoverage,
    List<String> shards,
    List<String> unavailableShards
) {

    public BarQueryResult {
        bars = List.copyOf(bars);
        shards = List.copyOf(shards);
        unavailableShards = List.copyOf(unavailableShards);
    }

    /** Result for a range that lies outside every known shard of the symbol. */
    public static BarQueryResult empty(Category category, String symbol, TimeRange range, Granularity granularity) {
        return new BarQueryResult(category, symbol, range, granularity, granularity,
            List.of(), false, List.of(), List.of());
    }
}
