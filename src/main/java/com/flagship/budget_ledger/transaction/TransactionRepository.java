package com.flagship.budget_ledger.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for transaction persistence and the range queries the calculators need.
 */
@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    Optional<TransactionEntity> findByIdAndBudgetId(UUID id, UUID budgetId);

    List<TransactionEntity> findByAccountIdAndStatus(UUID accountId, TransactionStatus status);

    List<TransactionEntity> findByAccountId(UUID accountId);

    List<TransactionEntity> findByTransferGroupId(UUID transferGroupId);

    @Query("""
        SELECT t FROM TransactionEntity t
        WHERE t.accountId = :accountId
          AND t.transactionDate BETWEEN :start AND :end
        ORDER BY t.transactionDate ASC, t.createdAt ASC
        """)
    List<TransactionEntity> findByAccountAndPeriod(@Param("accountId") UUID accountId,
                                                   @Param("start") LocalDate start,
                                                   @Param("end") LocalDate end);

    @Query("""
        SELECT t FROM TransactionEntity t
        WHERE t.creditCardId = :cardId
          AND t.transactionDate BETWEEN :start AND :end
        ORDER BY t.transactionDate ASC, t.createdAt ASC
        """)
    List<TransactionEntity> findByCreditCardAndPeriod(@Param("cardId") UUID cardId,
                                                      @Param("start") LocalDate start,
                                                      @Param("end") LocalDate end);

    @Query("""
        SELECT t FROM TransactionEntity t
        WHERE t.budgetId = :budgetId
          AND t.categoryId = :categoryId
          AND t.type = :type
          AND t.status = :status
          AND t.transactionDate BETWEEN :start AND :end
        """)
    List<TransactionEntity> findForCategoryUsage(@Param("budgetId") UUID budgetId,
                                                 @Param("categoryId") UUID categoryId,
                                                 @Param("type") TransactionType type,
                                                 @Param("status") TransactionStatus status,
                                                 @Param("start") LocalDate start,
                                                 @Param("end") LocalDate end);

    @Modifying
    @Query("DELETE FROM TransactionEntity t WHERE t.accountId = :accountId")
    int deleteByAccountId(@Param("accountId") UUID accountId);
}
