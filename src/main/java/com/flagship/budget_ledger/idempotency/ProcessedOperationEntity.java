package com.flagship.budget_ledger.idempotency;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable record of a keyed ledger command. The unique constraint on
 * (budget_id, idempotency_key) makes a concurrent duplicate fail at commit.
 */
@Entity
@Table(name = "ledger_operations",
    uniqueConstraints = @UniqueConstraint(name = "uq_ledger_operations_key",
        columnNames = {"budget_id", "idempotency_key"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProcessedOperationEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "budget_id", nullable = false, updatable = false)
    private UUID budgetId;

    @Column(name = "idempotency_key", nullable = false, updatable = false)
    private String idempotencyKey;

    @Column(name = "operation", nullable = false, updatable = false, length = 100)
    private String operation;

    @Column(name = "result_id", nullable = false, updatable = false)
    private UUID resultId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static ProcessedOperationEntity of(UUID budgetId, String idempotencyKey, String operation, UUID resultId) {
        return new ProcessedOperationEntity(UUID.randomUUID(), budgetId, idempotencyKey, operation, resultId,
            Instant.now());
    }
}
