package com.fintech.history.exception;

/**
 * No shard covers the requested category and symbol at all.
 */
public class ShardNotFoundException extends HistoryQueryException {

    public ShardNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
