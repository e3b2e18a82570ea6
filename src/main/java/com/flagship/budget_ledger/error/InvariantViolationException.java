package com.flagship.budget_ledger.error;

/**
 * Raised when persisted state contradicts an invariant the ledger maintains,
 * such as a credit card with more than one OPEN bill.
 */
public class InvariantViolationException extends LedgerException {

    public InvariantViolationException(String message) {
        super(LedgerErrorKind.INVARIANT_VIOLATION, message);
    }
}
