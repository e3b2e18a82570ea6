package com.flagship.budget_ledger.error;

/**
 * Goal reservation would leave the [0, target] range, or the goal is not ACTIVE.
 */
public class InvalidGoalStateException extends LedgerException {

    public InvalidGoalStateException(String message) {
        super(LedgerErrorKind.INVALID_GOAL_STATE, message);
    }
}
