package com.fintech.history.cache;

import com.fintech.history.domain.QueryFingerprint;

import java.time.Instant;

/**
 * Cached result with its absolute expiry.
 */
record CacheEntry(QueryFingerprint key, Object value, Instant createdAt, Instant expiresAt) {

    boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
