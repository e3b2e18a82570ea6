package com.flagship.budget_ledger.creditcard;

import java.util.EnumSet;
import java.util.Set;

/**
 * Credit card bill status.
 *
 * <pre>
 * OPEN    -> CLOSED
 * CLOSED  -> PAID | OVERDUE
 * OVERDUE -> PAID
 * PAID: terminal
 * </pre>
 */
public enum BillStatus {
    /** Current cycle, still accepting purchases. At most one per card. */
    OPEN,
    /** Cycle ended, waiting for payment. */
    CLOSED,
    /** Settled by a bill payment. Terminal; the bill can no longer change. */
    PAID,
    /** Due date passed without payment. */
    OVERDUE;

    public Set<BillStatus> allowedTransitions() {
        return switch (this) {
            case OPEN -> EnumSet.of(CLOSED);
            case CLOSED -> EnumSet.of(PAID, OVERDUE);
            case OVERDUE -> EnumSet.of(PAID);
            case PAID -> EnumSet.noneOf(BillStatus.class);
        };
    }

    public boolean canTransitionTo(BillStatus target) {
        return allowedTransitions().contains(target);
    }
}
