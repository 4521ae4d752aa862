package com.fintech.history.query;

import com.fintech.history.domain.ShardDescriptor;
import com.fintech.history.domain.TimeRange;

import java.util.List;
import java.util.Objects;

/**
 * Disposable description of one cross-shard read: which shards, in which order, under which predicate.
 *
 * @param symbol ticker (or underlying) bound into every branch
 * @param range half-open time range bound into every branch
 * @param primary first shard by coverage start
 * @param auxiliaries remaining shards by coverage start
 * @param branches one predicate-filtered branch per shard, primary first
 */
public record QueryPlan(
    String symbol,
    TimeRange range,
    ShardDescriptor primary,
    List<ShardDescriptor> auxiliaries,
    List<Branch> branches
) {

    public QueryPlan {
        Objects.requireNonNull(symbol, "Symbol cannot be null");
        Objects.requireNonNull(range, "Range cannot be null");
        Objects.requireNonNull(primary, "Primary shard cannot be null");
        auxiliaries = List.copyOf(auxiliaries);
        branches = List.copyOf(branches);
    }

    public int shardCount() {
        return branches.size();
    }

    /**
     * @param shard shard the branch reads
     * @param precedence seam rank; on equal timestamps the highest precedence row wins
     * @param bound predicate range, the plan range
     */
    public record Branch(ShardDescriptor shard, int precedence, TimeRange bound) {
    }
}
