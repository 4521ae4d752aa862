package com.fintech.history.exception;

/**
 * Implied volatility could not be solved for one contract. Never aborts a chain.
 */
public class IvConvergenceException extends HistoryQueryException {

    public IvConvergenceException(String message) {
        super(ErrorCode.IV_CONVERGENCE_FAILED, message);
    }
}
