package com.fintech.history.exception;

/**
 * Base type for failures raised by the shard query engine.
 */
public abstract class HistoryQueryException extends RuntimeException {

    private final ErrorCode errorCode;

    protected HistoryQueryException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected HistoryQueryException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
