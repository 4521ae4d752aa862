package com.fintech.history.catalog;

import com.fintech.history.domain.Category;
import com.fintech.history.domain.ShardDescriptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable view of every shard found by one catalog scan.
 * Shards are grouped by (category, symbol) and sorted by ascending coverage start.
 */
public final class CatalogSnapshot {

    private final long version;
    private final Instant scannedAt;
    private final List<ShardDescriptor> shards;
    private final Map<String, List<ShardDescriptor>> bySymbol;

    CatalogSnapshot(long version, Instant scannedAt, Collection<ShardDescriptor> shards) {
        this.version = version;
        this.scannedAt = scannedAt;

        List<ShardDescriptor> sorted = new ArrayList<>(shards);
        sorted.sort(Comparator.comparing(ShardDescriptor::category)
            .thenComparing(ShardDescriptor::symbol)
            .thenComparing(ShardDescriptor.PRECEDENCE));
        this.shards = List.copyOf(sorted);

        Map<String, List<ShardDescriptor>> grouped = new HashMap<>();
        for (ShardDescriptor shard : this.shards) {
            grouped.computeIfAbsent(key(shard.category(), shard.symbol()), k -> new ArrayList<>()).add(shard);
        }
        Map<String, List<ShardDescriptor>> frozen = new HashMap<>();
        grouped.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.bySymbol = Map.copyOf(frozen);
    }

    static CatalogSnapshot empty() {
        return new CatalogSnapshot(0, Instant.EPOCH, List.of());
    }

    /** Shards of one symbol, sorted by coverage start. Empty if the symbol is unknown. */
    public List<ShardDescriptor> shardsFor(Category category, String symbol) {
        return bySymbol.getOrDefault(key(category, symbol), List.of());
    }

    public List<ShardDescriptor> all() {
        return shards;
    }

    public int size() {
        return shards.size();
    }

    public long version() {
        return version;
    }

    public Instant scannedAt() {
        return scannedAt;
    }

    private static String key(Category category, String symbol) {
        return category.name() + ":" + symbol.toUpperCase(Locale.ROOT);
    }
}
