package com.fintech.history.storage;

import com.fintech.history.config.HistoryProperties;
import com.fintech.history.domain.ShardDescriptor;
import com.fintech.history.exception.QueryCancelledException;
import com.fintech.history.exception.ShardUnavailableException;
import com.zaxxer.hikari.HikariDataSource;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.nio.file.Files;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Arena of per-shard connection slots.
 *
 * <p>Each shard gets its own lazily created HikariCP pool, capped at one live connection unless the shard
 * is configured as hot. Slot bookkeeping (which slots exist, how many leases each has out) is the only
 * state shared between queries; it is mutated inside short map and slot locks that never do I/O.
 * Opening, probing and closing connections happen after those locks are released.
 *
 * <p>A shard that fails to open is degraded through its own circuit breaker and refused until the
 * configured cool-down has passed. Waiting too long for a busy shard is reported the same way to the
 * caller but does not degrade the shard.
 */
public class ShardConnectionPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ShardConnectionPool.class);

    private static final String SQLITE_DRIVER = "org.sqlite.JDBC";
    private static final String OPEN_MODE_PROPERTY = "open_mode";
    private static final int SQLITE_OPEN_READONLY = 0x01;
    private static final String PROBE_QUERY = "SELECT count(*) FROM sqlite_master";

    private final HistoryProperties.Pool settings;
    private final ShardCredential credential;
    private final CircuitBreakerRegistry breakers;
    private final ConcurrentHashMap<String, ShardSlot> slots = new ConcurrentHashMap<>();
    private final AtomicInteger activeLeases = new AtomicInteger(0);
    private final Counter openFailures;
    private final Counter exhaustedWaits;
    private volatile boolean closed;

    public ShardConnectionPool(
            HistoryProperties.Pool settings,
            ShardCredential credential,
            CircuitBreakerRegistry breakers,
            MeterRegistry meterRegistry) {
        this.settings = settings;
        this.credential = credential;
        this.breakers = breakers;

        meterRegistry.gauge("history.pool.slots.open", slots, Map::size);
        meterRegistry.gauge("history.pool.leases.active", activeLeases);
        this.openFailures = meterRegistry.counter("history.pool.open.failures");
        this.exhaustedWaits = meterRegistry.counter("history.pool.exhausted");

        breakers.getEventPublisher().onEntryAdded(event ->
            event.getAddedEntry().getEventPublisher().onStateTransition(transition ->
                log.warn("Shard {} breaker state changed: {} -> {}",
                    transition.getCircuitBreakerName(),
                    transition.getStateTransition().getFromState(),
                    transition.getStateTransition().getToState())
            )
        );
    }

    /**
     * Borrows a connection to the shard, opening its slot on first use.
     *
     * @throws ShardUnavailableException if the shard is degraded, cannot be opened, or stays busy
     *                                   beyond the connection timeout
     * @throws QueryCancelledException if the calling thread is interrupted
     */
    public ShardLease acquire(ShardDescriptor shard) {
        if (Thread.currentThread().isInterrupted()) {
            throw new QueryCancelledException("Interrupted before acquiring shard " + shard.id());
        }
        if (closed) {
            throw new IllegalStateException("Shard connection pool is closed");
        }

        CircuitBreaker breaker = breakers.circuitBreaker(shard.id());
        if (!breaker.tryAcquirePermission()) {
            throw new ShardUnavailableException(shard.id(),
                "degraded after an open failure, retry after cool-down of " + settings.getCoolDown());
        }

        long startNanos = System.nanoTime();
        if (!Files.isReadable(shard.path())) {
            throw recordOpenFailure(breaker, startNanos,
                new ShardUnavailableException(shard.id(), "file missing or unreadable: " + shard.path()));
        }

        ShardSlot slot = reserve(shard);
        enforceOpenShardLimit(slot);

        Connection connection;
        try {
            connection = slot.dataSource.getConnection();
        } catch (SQLException | RuntimeException e) {
            releaseReservation(slot);
            if (Thread.currentThread().isInterrupted()) {
                breaker.releasePermission();
                throw new QueryCancelledException("Interrupted while waiting for shard " + shard.id(), e);
            }
            if (isExhausted(e)) {
                breaker.releasePermission();
                exhaustedWaits.increment();
                throw new ShardUnavailableException(shard.id(),
                    "no connection free within " + settings.getConnectionTimeout(), e);
            }
            retire(slot);
            throw recordOpenFailure(breaker, startNanos,
                new ShardUnavailableException(shard.id(), "open failed: " + e.getMessage(), e));
        }

        try {
            probe(connection);
        } catch (SQLException e) {
            closeConnection(shard, connection);
            releaseReservation(slot);
            retire(slot);
            throw recordOpenFailure(breaker, startNanos,
                new ShardUnavailableException(shard.id(), "probe failed: " + e.getMessage(), e));
        }

        breaker.onSuccess(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        activeLeases.incrementAndGet();
        log.debug("Leased shard={}, activeLeases={}", shard.id(), activeLeases.get());
        return new ShardLease(shard, connection, () -> release(slot, connection));
    }

    /**
     * Closes slots that have had no lease out for longer than the idle timeout.
     *
     * @return number of slots closed
     */
    @Scheduled(fixedDelayString = "${history.pool.sweep-interval:PT30S}")
    public int sweepIdle() {
        long idleNanos = settings.getIdleTimeout().toNanos();
        long now = System.nanoTime();
        int evicted = 0;
        for (ShardSlot slot : slots.values()) {
            if (slot.idleLongerThan(now, idleNanos) && evictIfIdle(slot)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Idle sweep closed {} shard slot(s), open={}", evicted, slots.size());
        }
        return evicted;
    }

    /** True while the shard's breaker refuses new opens. */
    public boolean isDegraded(ShardDescriptor shard) {
        return breakers.find(shard.id())
            .map(b -> b.getState() == CircuitBreaker.State.OPEN)
            .orElse(false);
    }

    public int openSlots() {
        return slots.size();
    }

    public int activeLeases() {
        return activeLeases.get();
    }

    /** Ids of shards with an open slot. */
    public List<String> openShardIds() {
        return slots.values().stream().map(s -> s.shard.id()).sorted().collect(Collectors.toList());
    }

    @Override
    public void close() {
        closed = true;
        for (ShardSlot slot : slots.values()) {
            slots.remove(slot.key, slot);
            if (slot.markClosed()) {
                closeDataSource(slot);
            }
        }
        log.info("Shard connection pool closed");
    }

    private ShardSlot reserve(ShardDescriptor shard) {
        String key = shard.path().toAbsolutePath().normalize().toString();
        return slots.compute(key, (k, existing) -> {
            ShardSlot slot = existing != null ? existing : new ShardSlot(k, shard, newDataSource(shard));
            slot.borrow();
            return slot;
        });
    }

    private void release(ShardSlot slot, Connection connection) {
        try {
            closeConnection(slot.shard, connection);
        } finally {
            activeLeases.decrementAndGet();
            releaseReservation(slot);
        }
    }

    private void releaseReservation(ShardSlot slot) {
        if (slot.giveBack()) {
            closeDataSource(slot);
        }
    }

    private void retire(ShardSlot slot) {
        slots.remove(slot.key, slot);
        if (slot.markRetired()) {
            closeDataSource(slot);
        }
    }

    private boolean evictIfIdle(ShardSlot slot) {
        boolean[] evicted = {false};
        slots.computeIfPresent(slot.key, (k, current) -> {
            if (current != slot || !slot.retireIfIdle()) {
                return current;
            }
            evicted[0] = true;
            return null;
        });
        if (evicted[0]) {
            closeDataSource(slot);
        }
        return evicted[0];
    }

    private void enforceOpenShardLimit(ShardSlot justReserved) {
        int excess = slots.size() - settings.getMaxOpenShards();
        if (excess <= 0) {
            return;
        }
        List<ShardSlot> idle = slots.values().stream()
            .filter(s -> s != justReserved && s.isIdle())
            .sorted(Comparator.comparingLong(ShardSlot::lastUsedNanos))
            .collect(Collectors.toList());
        for (ShardSlot candidate : idle) {
            if (excess <= 0) {
                break;
            }
            if (evictIfIdle(candidate)) {
                excess--;
                log.debug("Displaced least recently used shard slot {}", candidate.shard.id());
            }
        }
        if (excess > 0) {
            log.debug("Open shard limit {} exceeded by {}: all slots busy", settings.getMaxOpenShards(), excess);
        }
    }

    private HikariDataSource newDataSource(ShardDescriptor shard) {
        // no-arg construction defers pool start (and all I/O) to the first getConnection()
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("shard-" + shard.id());
        dataSource.setDriverClassName(SQLITE_DRIVER);
        dataSource.setJdbcUrl("jdbc:sqlite:" + shard.path().toAbsolutePath());
        dataSource.addDataSourceProperty(OPEN_MODE_PROPERTY, Integer.toString(SQLITE_OPEN_READONLY));
        // sqlite-jdbc refuses to flip the flag once open, so Hikari's reset must agree with open_mode
        dataSource.setReadOnly(true);
        dataSource.setMaximumPoolSize(Math.max(1, settings.maxConnectionsFor(shard.id())));
        dataSource.setMinimumIdle(0);
        dataSource.setConnectionTimeout(settings.getConnectionTimeout().toMillis());
        dataSource.setConnectionTestQuery("SELECT 1");
        String keyPragma = credential.keyPragma();
        if (keyPragma != null) {
            dataSource.setConnectionInitSql(keyPragma);
        }
        return dataSource;
    }

    private void probe(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(PROBE_QUERY)) {
            rs.next();
        }
    }

    private ShardUnavailableException recordOpenFailure(
            CircuitBreaker breaker, long startNanos, ShardUnavailableException failure) {
        openFailures.increment();
        breaker.onError(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS, failure);
        log.warn("{}; cooling down for {}", failure.getMessage(), settings.getCoolDown());
        return failure;
    }

    private static boolean isExhausted(Exception e) {
        // Hikari reports a plain timeout without cause when every connection is leased
        return e instanceof SQLTransientConnectionException && e.getCause() == null;
    }

    private static void closeConnection(ShardDescriptor shard, Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to return connection for shard {}: {}", shard.id(), e.getMessage());
        }
    }

    private static void closeDataSource(ShardSlot slot) {
        slot.dataSource.close();
        log.info("Closed shard slot {}", slot.shard.id());
    }

    /**
     * One shard's data source plus its lease count. Counter updates are guarded by the slot's monitor.
     */
    private static final class ShardSlot {
        final String key;
        final ShardDescriptor shard;
        final HikariDataSource dataSource;

        private int borrowed;
        private long lastUsedNanos = System.nanoTime();
        private boolean retired;
        private boolean closed;

        ShardSlot(String key, ShardDescriptor shard, HikariDataSource dataSource) {
            this.key = key;
            this.shard = shard;
            this.dataSource = dataSource;
        }

        synchronized void borrow() {
            borrowed++;
            lastUsedNanos = System.nanoTime();
        }

        /** @return true if the caller must close the data source */
        synchronized boolean giveBack() {
            borrowed--;
            lastUsedNanos = System.nanoTime();
            return closeIfRetiredAndIdle();
        }

        /** @return true if the caller must close the data source */
        synchronized boolean markRetired() {
            retired = true;
            return closeIfRetiredAndIdle();
        }

        synchronized boolean retireIfIdle() {
            if (borrowed > 0) {
                return false;
            }
            retired = true;
            closed = true;
            return true;
        }

        synchronized boolean markClosed() {
            if (closed) {
                return false;
            }
            retired = true;
            closed = true;
            return true;
        }

        synchronized boolean isIdle() {
            return borrowed == 0;
        }

        synchronized boolean idleLongerThan(long now, long idleNanos) {
            return borrowed == 0 && now - lastUsedNanos > idleNanos;
        }

        synchronized long lastUsedNanos() {
            return lastUsedNanos;
        }

        private boolean closeIfRetiredAndIdle() {
            if (retired && borrowed == 0 && !closed) {
                closed = true;
                return true;
            }
            return false;
        }
    }
}
