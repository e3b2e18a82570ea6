package com.flagship.budget_ledger.idempotency;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProcessedOperationRepository extends JpaRepository<ProcessedOperationEntity, UUID> {

    Optional<ProcessedOperationEntity> findByBudgetIdAndIdempotencyKey(UUID budgetId, String idempotencyKey);
}
