package com.fintech.history.query;

import com.fintech.history.domain.Bar;
import com.fintech.history.exception.NoDataSourceException;
import com.fintech.history.exception.QueryCancelledException;
import com.fintech.history.exception.StorageException;
import com.fintech.history.storage.ShardLease;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An opened {@link QueryPlan}: the leases it holds and the merged row stream over them.
 *
 * <p>Closing the execution (directly, or by closing the stream from {@link #bars()}) closes every cursor
 * and returns every lease, whether iteration finished, failed, or was abandoned.
 */
public final class PlanExecution implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PlanExecution.class);

    static final String BAR_QUERY =
        "SELECT ts, o, h, l, c, v, trades, vwap FROM bars_eq WHERE ticker = ? AND ts >= ? AND ts < ? ORDER BY ts";

    /** Output order: timestamp ascending, then highest seam precedence first. */
    private static final Comparator<BranchCursor> MERGE_ORDER = Comparator
        .comparingLong((BranchCursor c) -> c.current.timestamp())
        .thenComparing(c -> c.branch.precedence(), Comparator.reverseOrder());

    private final QueryPlan plan;
    private final List<OpenBranch> branches;
    private final List<String> unavailable;
    private final Counter skippedRows;
    private final List<BranchCursor> cursors = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private boolean streamed;
    private long duplicatesDropped;

    PlanExecution(QueryPlan plan, List<OpenBranch> branches, List<String> unavailable, Counter skippedRows) {
        this.plan = plan;
        this.branches = List.copyOf(branches);
        this.unavailable = new ArrayList<>(unavailable);
        this.skippedRows = skippedRows;
    }

    public QueryPlan plan() {
        return plan;
    }

    /** Leases held for the plan's reachable shards, in precedence order. */
    public List<ShardLease> leases() {
        return branches.stream().map(OpenBranch::lease).collect(Collectors.toList());
    }

    /** Ids of shards that are contributing (or would contribute) rows. */
    public List<String> contributingShards() {
        return branches.stream()
            .map(b -> b.branch().shard().id())
            .filter(id -> !unavailable.contains(id))
            .collect(Collectors.toList());
    }

    /** Ids of shards skipped because they could not be opened or queried. */
    public List<String> unavailableShards() {
        return List.copyOf(unavailable);
    }

    public boolean isPartial() {
        return !unavailable.isEmpty();
    }

    /** Marks a shard as unreadable after it was opened, e.g. when its schema lacks a table. */
    public void markUnavailable(String shardId) {
        if (!unavailable.contains(shardId)) {
            unavailable.add(shardId);
        }
    }

    public long duplicatesDropped() {
        return duplicatesDropped;
    }

    /**
     * Lazily merged bars of every reachable shard, non-decreasing by timestamp.
     * Where shards overlap at a seam, exactly one bar per timestamp survives: the one from the shard
     * with the later coverage start. Closing the stream closes this execution. Iteration fails with
     * {@link NoDataSourceException} when no leased shard can be queried.
     *
     * @throws IllegalStateException if called more than once
     */
    public Stream<Bar> bars() {
        if (streamed) {
            throw new IllegalStateException("Plan execution bars can be consumed only once");
        }
        streamed = true;
        Iterator<Bar> merged = new MergeIterator();
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(merged, Spliterator.ORDERED | Spliterator.NONNULL), false)
            .onClose(this::close);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        cursors.forEach(BranchCursor::close);
        branches.forEach(b -> b.lease().close());
        if (duplicatesDropped > 0) {
            log.debug("Closed execution for {}: {} seam duplicate(s) dropped", plan.symbol(), duplicatesDropped);
        }
    }

    record OpenBranch(QueryPlan.Branch branch, ShardLease lease) {
    }

    private final class MergeIterator implements Iterator<Bar> {

        private final PriorityQueue<BranchCursor> queue = new PriorityQueue<>(MERGE_ORDER);
        private boolean started;

        @Override
        public boolean hasNext() {
            checkCancelled();
            if (!started) {
                start();
            }
            return !queue.isEmpty();
        }

        @Override
        public Bar next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            BranchCursor head = queue.poll();
            Bar bar = head.current;
            requeue(head);

            while (!queue.isEmpty() && queue.peek().current.timestamp() == bar.timestamp()) {
                BranchCursor shadowed = queue.poll();
                duplicatesDropped++;
                requeue(shadowed);
            }
            return bar;
        }

        private void start() {
            started = true;
            if (closed.get()) {
                throw new IllegalStateException("Plan execution already closed");
            }
            int readable = 0;
            for (OpenBranch open : branches) {
                BranchCursor cursor = new BranchCursor(open.branch(), open.lease());
                cursors.add(cursor);
                try {
                    if (cursor.start()) {
                        queue.add(cursor);
                    }
                    readable++;
                } catch (SQLException e) {
                    cursor.close();
                    markUnavailable(open.branch().shard().id());
                    log.warn("Skipping unreadable shard {}: {}", open.branch().shard().id(), e.getMessage());
                }
            }
            if (readable == 0) {
                close();
                throw new NoDataSourceException(String.format(
                    "None of the %d shard(s) for %s could be read", plan.shardCount(), plan.symbol()),
                    unavailable);
            }
        }

        private void requeue(BranchCursor cursor) {
            try {
                if (cursor.advance()) {
                    queue.add(cursor);
                }
            } catch (SQLException e) {
                throw new StorageException("Failed reading shard " + cursor.branch.shard().id(), e);
            }
        }

        private void checkCancelled() {
            if (Thread.currentThread().isInterrupted()) {
                throw new QueryCancelledException("Query for " + plan.symbol() + " cancelled during iteration");
            }
        }
    }

    private final class BranchCursor {

        final QueryPlan.Branch branch;
        final ShardLease lease;
        private PreparedStatement statement;
        private ResultSet rows;
        Bar current;

        BranchCursor(QueryPlan.Branch branch, ShardLease lease) {
            this.branch = branch;
            this.lease = lease;
        }

        boolean start() throws SQLException {
            statement = lease.connection().prepareStatement(BAR_QUERY);
            statement.setString(1, plan.symbol());
            statement.setLong(2, branch.bound().startMillis());
            statement.setLong(3, branch.bound().endMillis());
            rows = statement.executeQuery();
            return advance();
        }

        boolean advance() throws SQLException {
            while (rows.next()) {
                Bar bar = mapRow();
                if (bar != null) {
                    current = bar;
                    return true;
                }
            }
            current = null;
            return false;
        }

        private Bar mapRow() throws SQLException {
            long ts = rows.getLong("ts");
            try {
                long trades = rows.getLong("trades");
                Long tradeCount = rows.wasNull() ? null : trades;
                double vwap = rows.getDouble("vwap");
                BigDecimal vwapValue = rows.wasNull() ? null : BigDecimal.valueOf(vwap);
                return new Bar(ts,
                    BigDecimal.valueOf(rows.getDouble("o")),
                    BigDecimal.valueOf(rows.getDouble("h")),
                    BigDecimal.valueOf(rows.getDouble("l")),
                    BigDecimal.valueOf(rows.getDouble("c")),
                    rows.getLong("v"),
                    tradeCount,
                    vwapValue);
            } catch (IllegalArgumentException e) {
                skippedRows.increment();
                log.warn("Skipping invalid row in shard={}, symbol={}, ts={}: {}",
                    branch.shard().id(), plan.symbol(), ts, e.getMessage());
                return null;
            }
        }

        void close() {
            try {
                if (rows != null) {
                    rows.close();
                }
                if (statement != null) {
                    statement.close();
                }
            } catch (SQLException e) {
                log.warn("Failed to close cursor on shard {}: {}", branch.shard().id(), e.getMessage());
            }
        }
    }
}
