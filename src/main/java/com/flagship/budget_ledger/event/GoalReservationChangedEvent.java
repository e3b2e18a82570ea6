package com.flagship.budget_ledger.event;

import com.flagship.budget_ledger.goal.Goal;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a goal's reservation or source account changes.
 * {@code change} is one of ADDED, REMOVED, MOVED.
 */
@Value
public class GoalReservationChangedEvent implements LedgerEvent {
    UUID eventId;
    UUID budgetId;
    UUID goalId;
    UUID sourceAccountId;
    UUID previousAccountId;
    String change;
    long deltaInCents;
    long currentAmountInCents;
    String currency;
    Instant occurredAt;

    public static final String EVENT_TYPE = "GoalReservationChanged";

    @Override
    public UUID getAggregateId() {
        return goalId;
    }

    @Override
    public String getAggregateType() {
        return "Goal";
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static GoalReservationChangedEvent amountChanged(Goal goal, String change, long deltaInCents, Instant occurredAt) {
        return new GoalReservationChangedEvent(UUID.randomUUID(), goal.getBudgetId(), goal.getId(),
            goal.getSourceAccountId(), null, change, deltaInCents,
            goal.getCurrentAmount().getAmountInCents(), goal.getCurrentAmount().getCurrency().name(), occurredAt);
    }

    public static GoalReservationChangedEvent moved(Goal goal, UUID previousAccountId, Instant occurredAt) {
        return new GoalReservationChangedEvent(UUID.randomUUID(), goal.getBudgetId(), goal.getId(),
            goal.getSourceAccountId(), previousAccountId, "MOVED", 0L,
            goal.getCurrentAmount().getAmountInCents(), goal.getCurrentAmount().getCurrency().name(), occurredAt);
    }
}
