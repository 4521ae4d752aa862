package com.fintech.history.query;

import com.fintech.history.domain.ShardDescriptor;
import com.fintech.history.domain.TimeRange;
import com.fintech.history.exception.NoDataSourceException;
import com.fintech.history.exception.ShardUnavailableException;
import com.fintech.history.storage.ShardConnectionPool;
import com.fintech.history.storage.ShardLease;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plans and opens reads that span several shards.
 *
 * <p>A plan binds the same ticker and half-open range into one branch per shard. Opening it borrows one
 * connection per shard; shards that cannot be borrowed are skipped and reported as partial coverage.
 * Rows are never copied between shards: {@link PlanExecution#bars()} merges the per-shard cursors lazily.
 */
public class CrossShardQueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(CrossShardQueryPlanner.class);

    private final ShardConnectionPool pool;
    private final Counter partialQueries;
    private final Counter skippedRows;

    public CrossShardQueryPlanner(ShardConnectionPool pool, MeterRegistry meterRegistry) {
        this.pool = pool;
        this.partialQueries = meterRegistry.counter("history.query.partial");
        this.skippedRows = meterRegistry.counter("history.rows.skipped");
    }

    /**
     * Builds a plan over shards already resolved by the catalog.
     *
     * @param shards shards sorted by coverage start; the first becomes the primary
     */
    public QueryPlan plan(List<ShardDescriptor> shards, String symbol, TimeRange range) {
        Objects.requireNonNull(shards, "Shards cannot be null");
        if (shards.isEmpty()) {
            throw new IllegalArgumentException("Cannot plan a query over zero shards");
        }

        List<ShardDescriptor> ordered = new ArrayList<>(shards);
        ordered.sort(ShardDescriptor.PRECEDENCE);

        List<QueryPlan.Branch> branches = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            branches.add(new QueryPlan.Branch(ordered.get(i), i, range));
        }

        QueryPlan plan = new QueryPlan(symbol, range, ordered.get(0),
            ordered.subList(1, ordered.size()), branches);
        log.debug("Planned query: symbol={}, range={}, primary={}, auxiliaries={}",
            symbol, range, plan.primary().id(), plan.auxiliaries().size());
        return plan;
    }

    /**
     * Borrows a connection for every branch. Unreachable shards are recorded, not thrown.
     *
     * @throws NoDataSourceException if no shard of the plan could be borrowed
     */
    public PlanExecution open(QueryPlan plan) {
        List<PlanExecution.OpenBranch> opened = new ArrayList<>();
        List<String> unavailable = new ArrayList<>();
        try {
            for (QueryPlan.Branch branch : plan.branches()) {
                try {
                    ShardLease lease = pool.acquire(branch.shard());
                    opened.add(new PlanExecution.OpenBranch(branch, lease));
                } catch (ShardUnavailableException e) {
                    unavailable.add(branch.shard().id());
                    log.warn("Skipping shard {} for symbol={}: {}", branch.shard().id(), plan.symbol(), e.getMessage());
                }
            }
        } catch (RuntimeException e) {
            opened.forEach(b -> b.lease().close());
            throw e;
        }

        if (opened.isEmpty()) {
            throw new NoDataSourceException(String.format(
                "None of the %d shard(s) for %s could be opened", plan.shardCount(), plan.symbol()), unavailable);
        }
        if (!unavailable.isEmpty()) {
            partialQueries.increment();
        }
        return new PlanExecution(plan, opened, unavailable, skippedRows);
    }
}
