package com.flagship.budget_ledger.goal;

import java.util.EnumSet;
import java.util.Set;

/**
 * Goal status.
 *
 * <pre>
 * ACTIVE -> PAUSED | COMPLETED | CANCELLED
 * PAUSED -> ACTIVE | COMPLETED | CANCELLED
 * COMPLETED, CANCELLED: terminal
 * </pre>
 *
 * Only ACTIVE goals reserve part of their source account's balance.
 */
public enum GoalStatus {
    ACTIVE,
    PAUSED,
    COMPLETED,
    CANCELLED;

    public Set<GoalStatus> allowedTransitions() {
        return switch (this) {
            case ACTIVE -> EnumSet.of(PAUSED, COMPLETED, CANCELLED);
            case PAUSED -> EnumSet.of(ACTIVE, COMPLETED, CANCELLED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(GoalStatus.class);
        };
    }

    public boolean canTransitionTo(GoalStatus target) {
        return allowedTransitions().contains(target);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
