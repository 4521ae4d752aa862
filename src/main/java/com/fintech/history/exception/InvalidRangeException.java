package com.fintech.history.exception;

import java.time.Instant;

/**
 * The requested range is empty or inverted, or lies entirely outside the known coverage of a symbol.
 * The latter is a legitimately empty result rather than a missing symbol.
 */
public class InvalidRangeException extends HistoryQueryException {

    public enum Reason {
        EMPTY_OR_INVERTED,
        OUTSIDE_COVERAGE
    }

    private final Reason reason;

    public InvalidRangeException(Reason reason, String message) {
        super(ErrorCode.INVALID_RANGE, message);
        this.reason = reason;
    }

    public static InvalidRangeException emptyOrInverted(long startMillis, long endMillis) {
        return new InvalidRangeException(Reason.EMPTY_OR_INVERTED, String.format(
            "Invalid time range: start (%s) must be before end (%s)",
            Instant.ofEpochMilli(startMillis), Instant.ofEpochMilli(endMillis)));
    }

    public Reason getReason() {
        return reason;
    }
}
