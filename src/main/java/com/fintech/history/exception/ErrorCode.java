package com.fintech.history.exception;

/**
 * Stable error identifiers surfaced in API error responses.
 */
public enum ErrorCode {
    NOT_FOUND,
    INVALID_RANGE,
    SHARD_UNAVAILABLE,
    NO_DATA_SOURCE,
    UNSUPPORTED_GRANULARITY,
    IV_CONVERGENCE_FAILED,
    QUERY_CANCELLED,
    STORAGE_ERROR
}
