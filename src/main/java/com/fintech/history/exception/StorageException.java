package com.fintech.history.exception;

/**
 * Wraps a SQL failure while reading an already opened shard.
 */
public class StorageException extends HistoryQueryException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_ERROR, message, cause);
    }
}
