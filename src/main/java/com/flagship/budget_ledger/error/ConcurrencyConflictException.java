package com.flagship.budget_ledger.error;

/**
 * A lock could not be acquired or a version check failed. Safe to retry.
 */
public class ConcurrencyConflictException extends LedgerException {

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(LedgerErrorKind.CONCURRENCY_CONFLICT, message, cause);
    }
}
