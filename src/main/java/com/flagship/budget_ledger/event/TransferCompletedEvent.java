package com.flagship.budget_ledger.event;

import com.flagship.budget_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when both legs of an account transfer have committed.
 */
@Value
public class TransferCompletedEvent implements LedgerEvent {
    UUID eventId;
    UUID budgetId;
    UUID transferGroupId;
    UUID fromAccountId;
    UUID toAccountId;
    UUID outgoingTransactionId;
    UUID incomingTransactionId;
    long amountInCents;
    String currency;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransferCompleted";

    @Override
    public UUID getAggregateId() {
        return transferGroupId;
    }

    @Override
    public String getAggregateType() {
        return "Transfer";
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransferCompletedEvent of(UUID budgetId, UUID transferGroupId, UUID fromAccountId, UUID toAccountId,
                                            UUID outgoingTransactionId, UUID incomingTransactionId,
                                            Money amount, Instant occurredAt) {
        return new TransferCompletedEvent(UUID.randomUUID(), budgetId, transferGroupId, fromAccountId, toAccountId,
            outgoingTransactionId, incomingTransactionId, amount.getAmountInCents(), amount.getCurrency().name(),
            occurredAt);
    }
}
