package com.flagship.budget_ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when an account and everything hanging off it has been removed.
 */
@Value
public class AccountDeletedEvent implements LedgerEvent {
    UUID eventId;
    UUID budgetId;
    UUID accountId;
    int deletedTransactions;
    int deletedGoals;
    List<UUID> recomputedBillIds;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountDeleted";

    @Override
    public UUID getAggregateId() {
        return accountId;
    }

    @Override
    public String getAggregateType() {
        return "Account";
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
