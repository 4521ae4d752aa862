package com.fintech.history.cache;

import com.fintech.history.domain.QueryFingerprint;
import com.fintech.history.exception.QueryCancelledException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Bounded query result cache with per-entry TTL.
 *
 * <p>Entries expire lazily when read after their TTL; at capacity the least recently used entry is
 * displaced. Concurrent misses on one fingerprint are collapsed: the first caller computes outside any
 * lock and the others wait for its result. A failed computation is handed to the callers that were
 * waiting on it and is never stored.
 */
public class ResultCache {

    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final int maxEntries;
    private final Clock clock;
    private final Object lock = new Object();
    private final Map<QueryFingerprint, CacheEntry> entries;
    private final ConcurrentHashMap<QueryFingerprint, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    private final Counter hits;
    private final Counter misses;
    private final Counter evictions;
    private final Counter joins;

    public ResultCache(int maxEntries, Clock clock, MeterRegistry meterRegistry) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive");
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
        this.hits = meterRegistry.counter("history.cache.hits");
        this.misses = meterRegistry.counter("history.cache.misses");
        this.evictions = meterRegistry.counter("history.cache.evictions");
        this.joins = meterRegistry.counter("history.cache.inflight.joins");
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<QueryFingerprint, CacheEntry> eldest) {
                boolean evict = size() > ResultCache.this.maxEntries;
                if (evict) {
                    evictions.increment();
                    log.debug("Evicted least recently used entry {}", eldest.getKey().toStringKey());
                }
                return evict;
            }
        };
        meterRegistry.gauge("history.cache.size", this, ResultCache::size);
    }

    /**
     * Returns the cached value for the fingerprint, computing and storing it on a miss.
     *
     * @param ttl how long a computed value stays valid
     * @param compute invoked at most once per miss across concurrent callers; must not return null
     * @throws QueryCancelledException if interrupted while waiting for another caller's computation
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(QueryFingerprint key, Duration ttl, Supplier<T> compute) {
        Objects.requireNonNull(key, "Fingerprint cannot be null");
        Object cached = lookup(key);
        if (cached != null) {
            hits.increment();
            return (T) cached;
        }

        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            joins.increment();
            return (T) await(key, running);
        }

        try {
            // a flight that finished between the lookup and the claim has already stored its value
            cached = lookup(key);
            if (cached != null) {
                hits.increment();
                mine.complete(cached);
                return (T) cached;
            }

            misses.increment();
            T value = Objects.requireNonNull(compute.get(), "Cached computation returned null");
            store(key, value, ttl);
            mine.complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public void invalidateAll() {
        synchronized (lock) {
            entries.clear();
        }
        log.info("Result cache invalidated");
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    private Object lookup(QueryFingerprint key) {
        Instant now = clock.instant();
        synchronized (lock) {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                log.debug("Expired entry {}", key.toStringKey());
                return null;
            }
            return entry.value();
        }
    }

    private void store(QueryFingerprint key, Object value, Duration ttl) {
        Instant now = clock.instant();
        CacheEntry entry = new CacheEntry(key, value, now, now.plus(ttl));
        synchronized (lock) {
            entries.put(key, entry);
        }
    }

    private Object await(QueryFingerprint key, CompletableFuture<Object> running) {
        try {
            return running.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryCancelledException("Interrupted waiting for " + key.toStringKey(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Cached computation failed for " + key.toStringKey(), cause);
        }
    }
}
