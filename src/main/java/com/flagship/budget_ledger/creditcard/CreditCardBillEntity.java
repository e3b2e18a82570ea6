package com.flagship.budget_ledger.creditcard;

import com.flagship.budget_ledger.money.CurrencyCode;
import com.flagship.budget_ledger.money.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * JPA Entity for credit card bills.
 *
 * The schema adds a partial unique index on (credit_card_id) WHERE status = 'OPEN'
 * so a second OPEN bill fails at the database even if application checks were
 * bypassed. {@code @Version} turns concurrent recomputations into optimistic
 * lock failures instead of lost updates.
 */
@Entity
@Table(
    name = "credit_card_bills",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_bill_card_period", columnNames = {"credit_card_id", "period_year", "period_month"})
    },
    indexes = {
        @Index(name = "idx_bills_card_status", columnList = "credit_card_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CreditCardBillEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "budget_id", nullable = false, updatable = false)
    private UUID budgetId;

    @Column(name = "credit_card_id", nullable = false, updatable = false)
    private UUID creditCardId;

    @Column(name = "period_year", nullable = false, updatable = false)
    private int periodYear;

    @Column(name = "period_month", nullable = false, updatable = false)
    private int periodMonth;

    @Column(name = "closing_date", nullable = false, updatable = false)
    private LocalDate closingDate;

    @Column(name = "due_date", nullable = false, updatable = false)
    private LocalDate dueDate;

    @Column(name = "amount_cents", nullable = false)
    private long amountInCents;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BillStatus status;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static CreditCardBillEntity fromDomain(CreditCardBill bill) {
        return new CreditCardBillEntity(
            bill.getId(),
            bill.getBudgetId(),
            bill.getCreditCardId(),
            bill.getPeriod().getYear(),
            bill.getPeriod().getMonthValue(),
            bill.getClosingDate(),
            bill.getDueDate(),
            bill.getAmount().getAmountInCents(),
            bill.getAmount().getCurrency(),
            bill.getStatus(),
            bill.getPaidAt(),
            0L,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public CreditCardBill toDomain() {
        return new CreditCardBill(
            id,
            budgetId,
            creditCardId,
            YearMonth.of(periodYear, periodMonth),
            closingDate,
            dueDate,
            Money.ofCents(amountInCents, currency),
            status,
            paidAt
        );
    }

    /**
     * Copies the fields that may change after creation: amount, status, paidAt.
     */
    void updateFromDomain(CreditCardBill bill) {
        this.amountInCents = bill.getAmount().getAmountInCents();
        this.status = bill.getStatus();
        this.paidAt = bill.getPaidAt();
    }
}
