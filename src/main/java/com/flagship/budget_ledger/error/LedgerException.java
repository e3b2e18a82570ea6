package com.flagship.budget_ledger.error;

import lombok.Getter;

/**
 * Base class of every business failure raised inside the ledger.
 *
 * These exceptions never cross the public boundary: {@code LedgerOperations} and
 * the mutation coordinator turn them into {@link LedgerResult} failures.
 */
@Getter
public abstract class LedgerException extends RuntimeException {

    private final LedgerErrorKind kind;

    protected LedgerException(LedgerErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected LedgerException(LedgerErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
