package com.fintech.history.exception;

/**
 * The requested granularity is neither stored nor derivable from any stored granularity.
 */
public class UnsupportedGranularityException extends HistoryQueryException {

    public UnsupportedGranularityException(String message) {
        super(ErrorCode.UNSUPPORTED_GRANULARITY, message);
    }
}
