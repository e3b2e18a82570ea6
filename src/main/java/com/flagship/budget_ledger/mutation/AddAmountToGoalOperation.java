package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.event.GoalReservationChangedEvent;
import com.flagship.budget_ledger.goal.Goal;
import com.flagship.budget_ledger.goal.GoalReservationManager;
import com.flagship.budget_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Reserves more of the source account's balance for a goal, under that account's
 * lock so concurrent reservations are checked one after the other.
 */
@Component
@RequiredArgsConstructor
public class AddAmountToGoalOperation implements LedgerOperation<GoalAmountCommand, Goal> {

    private final GoalReservationManager goalReservationManager;
    private final OutboxService outboxService;
    private final Clock clock;

    @Override
    public String name() {
        return "addAmountToGoal";
    }

    @Override
    public UUID budgetOf(GoalAmountCommand command) {
        return command.getBudgetId();
    }

    @Override
    public Collection<UUID> accountsToLock(GoalAmountCommand command) {
        return List.of(goalReservationManager.getGoal(command.getBudgetId(), command.getGoalId()).getSourceAccountId());
    }

    @Override
    public Goal execute(GoalAmountCommand command, LockedAccounts accounts) {
        Goal current = goalReservationManager.getGoal(command.getBudgetId(), command.getGoalId());
        accounts.get(current.getSourceAccountId());

        Goal updated = goalReservationManager.addAmount(command.getBudgetId(), command.getGoalId(), command.getAmount());
        outboxService.saveEvent(GoalReservationChangedEvent.amountChanged(
            updated, "ADDED", command.getAmount().getAmountInCents(), clock.instant()));
        return updated;
    }
}
