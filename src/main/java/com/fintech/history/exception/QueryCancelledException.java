package com.fintech.history.exception;

/**
 * The calling thread was interrupted while the query held or waited for shard connections.
 */
public class QueryCancelledException extends HistoryQueryException {

    public QueryCancelledException(String message) {
        super(ErrorCode.QUERY_CANCELLED, message);
    }

    public QueryCancelledException(String message, Throwable cause) {
        super(ErrorCode.QUERY_CANCELLED, message, cause);
    }
}
