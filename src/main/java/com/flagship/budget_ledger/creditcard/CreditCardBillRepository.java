package com.flagship.budget_ledger.creditcard;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for credit card bills.
 */
@Repository
public interface CreditCardBillRepository extends JpaRepository<CreditCardBillEntity, UUID> {

    Optional<CreditCardBillEntity> findByIdAndBudgetId(UUID id, UUID budgetId);

    Optional<CreditCardBillEntity> findByCreditCardIdAndPeriodYearAndPeriodMonth(
        UUID creditCardId, int periodYear, int periodMonth);

    List<CreditCardBillEntity> findByCreditCardIdAndStatus(UUID creditCardId, BillStatus status);

    List<CreditCardBillEntity> findByCreditCardIdOrderByPeriodYearAscPeriodMonthAsc(UUID creditCardId);

    /**
     * OPEN bills whose cycle has ended. Used by the cycle scheduler.
     */
    List<CreditCardBillEntity> findByStatusAndClosingDateBefore(BillStatus status, LocalDate date);

    /**
     * CLOSED bills past their due date. Used by the cycle scheduler.
     */
    List<CreditCardBillEntity> findByStatusAndDueDateBefore(BillStatus status, LocalDate date);
}
