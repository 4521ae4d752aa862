package com.fintech.history.storage;

import com.fintech.history.domain.ShardDescriptor;

import java.sql.Connection;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive loan of one pooled shard connection. Closing returns it to the pool exactly once,
 * however many times {@link #close()} is called.
 */
public final class ShardLease implements AutoCloseable {

    private final ShardDescriptor shard;
    private final Connection connection;
    private final Runnable releaser;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ShardLease(ShardDescriptor shard, Connection connection, Runnable releaser) {
        this.shard = shard;
        this.connection = connection;
        this.releaser = releaser;
    }

    public ShardDescriptor shard() {
        return shard;
    }

    /**
     * @throws IllegalStateException if the lease was already released
     */
    public Connection connection() {
        if (released.get()) {
            throw new IllegalStateException("Lease on " + shard.id() + " already released");
        }
        return connection;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            releaser.run();
        }
    }
}
