package com.flagship.budget_ledger.error;

import lombok.Getter;

import java.util.List;
import java.util.UUID;

/**
 * An account cannot be deleted while ACTIVE goals reserve part of its balance.
 * Transfer or cancel the goals first.
 */
@Getter
public class GoalStillAttachedException extends LedgerException {

    private final UUID accountId;
    private final List<UUID> goalIds;

    public GoalStillAttachedException(UUID accountId, List<UUID> goalIds) {
        super(LedgerErrorKind.GOAL_STILL_ATTACHED,
            String.format("Account %s still has active goals attached: %s", accountId, goalIds));
        this.accountId = accountId;
        this.goalIds = List.copyOf(goalIds);
    }
}
