package com.flagship.budget_ledger.creditcard;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CreditCardRepository extends JpaRepository<CreditCardEntity, UUID> {

    Optional<CreditCardEntity> findByIdAndBudgetId(UUID id, UUID budgetId);
}
