package com.flagship.budget_ledger.transaction;

import lombok.Value;

/**
 * A transaction before and after a status change. Callers use the pair to decide
 * which derived values need recomputing.
 */
@Value
public class StatusChange {
    Transaction before;
    Transaction after;

    public boolean affectsBalance() {
        return before.isCompleted() != after.isCompleted();
    }
}
