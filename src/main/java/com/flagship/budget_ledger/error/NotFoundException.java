package com.flagship.budget_ledger.error;

import java.util.UUID;

/**
 * Referenced aggregate does not exist, or exists in a different budget.
 */
public class NotFoundException extends LedgerException {

    public NotFoundException(String message) {
        super(LedgerErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException of(String aggregate, UUID id) {
        return new NotFoundException(aggregate + " not found: " + id);
    }
}
