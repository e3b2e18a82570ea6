package com.flagship.budget_ledger.error;

import lombok.Getter;

/**
 * Wraps an unexpected failure that happened part way through a mutation unit.
 *
 * Only raised after the unit has been rolled back, so no partial write survives it.
 */
@Getter
public class TransferExecutionException extends LedgerException {

    private final String operation;

    public TransferExecutionException(String operation, Throwable cause) {
        super(LedgerErrorKind.TRANSFER_EXECUTION,
            String.format("%s failed and was rolled back: %s", operation, describe(cause)),
            cause);
        this.operation = operation;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
