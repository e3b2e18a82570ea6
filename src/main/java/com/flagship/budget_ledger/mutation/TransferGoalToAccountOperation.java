package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.event.GoalReservationChangedEvent;
import com.flagship.budget_ledger.goal.Goal;
import com.flagship.budget_ledger.goal.GoalReservationManager;
import com.flagship.budget_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Moves a goal, and the balance it reserves, to another account.
 *
 * Both accounts are locked: the reservation is released on the old account and
 * taken on the new one in the same commit, so no reader ever sees the goal
 * unreserved or reserved twice.
 */
@Component
@RequiredArgsConstructor
public class TransferGoalToAccountOperation implements LedgerOperation<TransferGoalCommand, Goal> {

    private final GoalReservationManager goalReservationManager;
    private final OutboxService outboxService;
    private final Clock clock;

    @Override
    public String name() {
        return "transferGoalToAccount";
    }

    @Override
    public UUID budgetOf(TransferGoalCommand command) {
        return command.getBudgetId();
    }

    @Override
    public Collection<UUID> accountsToLock(TransferGoalCommand command) {
        if (command.getNewAccountId() == null) {
            throw new ValidationException("Destination account is required");
        }
        List<UUID> ids = new ArrayList<>(2);
        ids.add(goalReservationManager.getGoal(command.getBudgetId(), command.getGoalId()).getSourceAccountId());
        ids.add(command.getNewAccountId());
        return ids;
    }

    @Override
    public Goal execute(TransferGoalCommand command, LockedAccounts accounts) {
        Goal current = goalReservationManager.getGoal(command.getBudgetId(), command.getGoalId());
        UUID previousAccountId = current.getSourceAccountId();
        accounts.get(previousAccountId);
        accounts.getInBudget(command.getNewAccountId(), command.getBudgetId());

        Goal moved = goalReservationManager.transferToAccount(
            command.getBudgetId(), command.getGoalId(), command.getNewAccountId());
        outboxService.saveEvent(GoalReservationChangedEvent.moved(moved, previousAccountId, clock.instant()));
        return moved;
    }
}
