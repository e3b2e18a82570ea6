package com.flagship.budget_ledger.event;

import com.flagship.budget_ledger.transaction.Transaction;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a transaction is recorded. {@code billId} is set for credit card
 * purchases and names the bill the purchase landed on.
 */
@Value
public class TransactionRecordedEvent implements LedgerEvent {
    UUID eventId;
    UUID budgetId;
    UUID transactionId;
    UUID accountId;
    UUID categoryId;
    UUID creditCardId;
    UUID billId;
    long amountInCents;
    String currency;
    String type;
    String status;
    LocalDate transactionDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionRecorded";

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

    public static TransactionRecordedEvent of(Transaction tx, UUID billId, Instant occurredAt) {
        return new TransactionRecordedEvent(
            UUID.randomUUID(),
            tx.getBudgetId(),
            tx.getId(),
            tx.getAccountId(),
            tx.getCategoryId(),
            tx.getCreditCardId(),
            billId,
            tx.getAmount().getAmountInCents(),
            tx.getAmount().getCurrency().name(),
            tx.getType().name(),
            tx.getStatus().name(),
            tx.getTransactionDate(),
            occurredAt
        );
    }
}
