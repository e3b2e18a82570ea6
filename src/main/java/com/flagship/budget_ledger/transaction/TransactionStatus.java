package com.flagship.budget_ledger.transaction;

import java.util.EnumSet;
import java.util.Set;

/**
 * Transaction status with its allowed transitions.
 *
 * <pre>
 * SCHEDULED -> COMPLETED | OVERDUE | CANCELLED
 * OVERDUE   -> COMPLETED
 * COMPLETED, CANCELLED: terminal
 * </pre>
 *
 * Only COMPLETED transactions count toward balances and envelope usage.
 */
public enum TransactionStatus {
    SCHEDULED,
    COMPLETED,
    OVERDUE,
    CANCELLED;

    public Set<TransactionStatus> allowedTransitions() {
        return switch (this) {
            case SCHEDULED -> EnumSet.of(COMPLETED, OVERDUE, CANCELLED);
            case OVERDUE -> EnumSet.of(COMPLETED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(TransactionStatus.class);
        };
    }

    public boolean canTransitionTo(TransactionStatus target) {
        return allowedTransitions().contains(target);
    }

    /**
     * Statuses whose transactions are part of a credit card bill's total.
     */
    public boolean countsTowardBill() {
        return this == COMPLETED || this == SCHEDULED;
    }
}
