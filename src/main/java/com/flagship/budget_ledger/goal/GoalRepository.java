package com.flagship.budget_ledger.goal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GoalRepository extends JpaRepository<GoalEntity, UUID> {

    Optional<GoalEntity> findByIdAndBudgetId(UUID id, UUID budgetId);

    List<GoalEntity> findBySourceAccountId(UUID sourceAccountId);

    List<GoalEntity> findBySourceAccountIdAndStatus(UUID sourceAccountId, GoalStatus status);
}
