package com.flagship.budget_ledger.envelope;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface EnvelopeRepository extends JpaRepository<EnvelopeEntity, UUID> {

    Optional<EnvelopeEntity> findByIdAndBudgetId(UUID id, UUID budgetId);

    Optional<EnvelopeEntity> findByBudgetIdAndCategoryId(UUID budgetId, UUID categoryId);
}
