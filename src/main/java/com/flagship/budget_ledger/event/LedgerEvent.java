package com.flagship.budget_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for ledger events.
 *
 * Events are facts: each one describes a mutation unit that has committed. They
 * are written to the outbox inside that unit and published afterwards.
 */
public interface LedgerEvent {

    /**
     * Unique identifier for this event instance. Consumers deduplicate on it.
     */
    UUID getEventId();

    UUID getBudgetId();

    /**
     * Aggregate the event is keyed by; also the Kafka partition key.
     */
    UUID getAggregateId();

    String getAggregateType();

    Instant getOccurredAt();

    String getEventType();
}
