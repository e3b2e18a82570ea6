package com.flagship.budget_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A ledger event waiting in the outbox table to be published to Kafka.
 *
 * Written in the same unit as the mutation it describes, so it exists if and only
 * if that mutation committed.
 */
@Value
public class OutboxEvent {
    UUID id;
    UUID budgetId;
    String aggregateType;      // e.g. "Account", "Goal"
    UUID aggregateId;
    String eventType;          // e.g. "TransferCompleted"
    String payload;            // JSON payload
    String correlationId;
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(UUID budgetId, String aggregateType, UUID aggregateId,
                                     String eventType, String payload, String correlationId) {
        return new OutboxEvent(
            UUID.randomUUID(),
            budgetId,
            aggregateType,
            aggregateId,
            eventType,
            payload,
            correlationId,
            Instant.now(),
            null,  // not published yet
            0,
            null,
            null   // sequence assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
