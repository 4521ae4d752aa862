package com.fintech.history.api;

import com.fintech.history.domain.ShardDescriptor;

import java.time.LocalDate;

/**
 * Catalog entry as exposed over the API. The file path stays server-side.
 */
public record ShardView(
    String id,
    String category,
    String symbol,
    LocalDate coverageStart,
    LocalDate coverageEnd,
    String granularity,
    long sizeBytes,
    boolean degraded
) {

    static ShardView of(ShardDescriptor shard, boolean degraded) {
        return new ShardView(
            shard.id(),
            shard.category().prefix(),
            shard.symbol(),
            shard.coverageStart(),
            shard.coverageEnd(),
            shard.granularity().canonical(),
            shard.sizeBytes(),
            degraded);
    }
}
