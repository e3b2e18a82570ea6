package com.flagship.budget_ledger.error;

/**
 * Input is malformed or references an aggregate outside the caller's budget.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(LedgerErrorKind.VALIDATION, message);
    }
}
