package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.goal.Goal;
import com.flagship.budget_ledger.goal.GoalReservationManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Pauses, resumes, completes or cancels a goal. Resuming takes the reservation
 * back, so it runs under the source account's lock like any other reservation.
 */
@Component
@RequiredArgsConstructor
public class ChangeGoalStatusOperation implements LedgerOperation<GoalStatusCommand, Goal> {

    private final GoalReservationManager goalReservationManager;

    @Override
    public String name() {
        return "changeGoalStatus";
    }

    @Override
    public UUID budgetOf(GoalStatusCommand command) {
        return command.getBudgetId();
    }

    @Override
    public Collection<UUID> accountsToLock(GoalStatusCommand command) {
        return List.of(goalReservationManager.getGoal(command.getBudgetId(), command.getGoalId()).getSourceAccountId());
    }

    @Override
    public Goal execute(GoalStatusCommand command, LockedAccounts accounts) {
        if (command.getNewStatus() == null) {
            throw new ValidationException("Target goal status is required");
        }
        Goal current = goalReservationManager.getGoal(command.getBudgetId(), command.getGoalId());
        accounts.get(current.getSourceAccountId());
        return goalReservationManager.changeStatus(command.getBudgetId(), command.getGoalId(), command.getNewStatus());
    }
}
