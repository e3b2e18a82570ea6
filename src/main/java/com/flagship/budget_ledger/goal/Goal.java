package com.flagship.budget_ledger.goal;

import com.flagship.budget_ledger.error.InvalidGoalStateException;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.money.Money;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Savings goal reserving part of its source account's balance.
 *
 * Key principles:
 * - 0 <= currentAmount <= targetAmount at all times
 * - Amounts can only be added while ACTIVE
 * - Whether the source account can afford a reservation is checked by
 *   {@link GoalReservationManager}, which can see the account
 * - State changes return a new instance
 */
@Value
public class Goal {
    UUID id;
    UUID budgetId;
    String name;
    Money targetAmount;
    Money currentAmount;
    LocalDate targetDate;
    UUID sourceAccountId;
    GoalStatus status;

    public boolean isActive() {
        return status == GoalStatus.ACTIVE;
    }

    public Money remaining() {
        return targetAmount.minus(currentAmount);
    }

    /**
     * @throws InvalidGoalStateException if the goal is not ACTIVE or the target would be exceeded
     */
    public Goal add(Money amount) {
        requirePositive(amount);
        if (!isActive()) {
            throw new InvalidGoalStateException(String.format(
                "Goal %s is %s; amounts can only be added to ACTIVE goals", id, status));
        }
        Money updated = currentAmount.plus(amount);
        if (updated.isGreaterThan(targetAmount)) {
            throw new InvalidGoalStateException(String.format(
                "Adding %s to goal %s would exceed its target %s (current %s)",
                amount, id, targetAmount, currentAmount));
        }
        return withCurrentAmount(updated);
    }

    /**
     * @throws InvalidGoalStateException if the goal is finished or the amount would go below zero
     */
    public Goal remove(Money amount) {
        requirePositive(amount);
        if (status.isTerminal()) {
            throw new InvalidGoalStateException(String.format("Goal %s is %s", id, status));
        }
        Money updated = currentAmount.minus(amount);
        if (updated.isNegative()) {
            throw new InvalidGoalStateException(String.format(
                "Removing %s from goal %s would leave a negative amount (current %s)",
                amount, id, currentAmount));
        }
        return withCurrentAmount(updated);
    }

    public Goal moveTo(UUID newSourceAccountId) {
        return new Goal(id, budgetId, name, targetAmount, currentAmount, targetDate, newSourceAccountId, status);
    }

    /**
     * @throws InvalidGoalStateException if the status machine forbids the transition
     */
    public Goal withStatus(GoalStatus newStatus) {
        if (!status.canTransitionTo(newStatus)) {
            throw new InvalidGoalStateException(String.format(
                "Cannot move goal %s from %s to %s", id, status, newStatus));
        }
        return new Goal(id, budgetId, name, targetAmount, currentAmount, targetDate, sourceAccountId, newStatus);
    }

    private Goal withCurrentAmount(Money updated) {
        return new Goal(id, budgetId, name, targetAmount, updated, targetDate, sourceAccountId, status);
    }

    private static void requirePositive(Money amount) {
        if (amount == null || !amount.isPositive()) {
            throw new ValidationException("Goal amount must be positive: " + amount);
        }
    }
}
