package com.flagship.budget_ledger.transaction;

import com.flagship.budget_ledger.money.CurrencyCode;
import com.flagship.budget_ledger.money.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * JPA Entity for Transaction persistence.
 *
 * Key design principles:
 * - No setters: only status and category change after insert, via updateFromDomain()
 * - Amount, account, card and date are updatable = false
 * - Timestamps come from lifecycle hooks
 */
@Entity
@Table(
    name = "ledger_transactions",
    indexes = {
        @Index(name = "idx_tx_account_status", columnList = "account_id, status"),
        @Index(name = "idx_tx_card_date", columnList = "credit_card_id, transaction_date"),
        @Index(name = "idx_tx_budget_category_date", columnList = "budget_id, category_id, transaction_date")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "budget_id", nullable = false, updatable = false)
    private UUID budgetId;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "category_id", nullable = false)
    private UUID categoryId;

    @Column(name = "credit_card_id", updatable = false)
    private UUID creditCardId;

    @Column(name = "amount_cents", nullable = false, updatable = false)
    private long amountInCents;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, updatable = false)
    private TransactionType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "transfer_direction", updatable = false)
    private TransferDirection transferDirection;

    @Column(name = "transfer_group_id", updatable = false)
    private UUID transferGroupId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TransactionStatus status;

    @Column(name = "transaction_date", nullable = false, updatable = false)
    private LocalDate transactionDate;

    @Column(nullable = false)
    private String description;

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

    static TransactionEntity fromRequest(UUID id, NewTransaction request) {
        return new TransactionEntity(
            id,
            request.getBudgetId(),
            request.getAccountId(),
            request.getCategoryId(),
            request.getCreditCardId(),
            request.getAmount().getAmountInCents(),
            request.getAmount().getCurrency(),
            request.getType(),
            request.getTransferDirection(),
            request.getTransferGroupId(),
            request.getStatus(),
            request.getTransactionDate(),
            request.getDescription() != null ? request.getDescription() : "",
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Transaction toDomain() {
        return new Transaction(
            id,
            budgetId,
            accountId,
            categoryId,
            creditCardId,
            Money.ofCents(amountInCents, currency),
            type,
            transferDirection,
            transferGroupId,
            status,
            transactionDate,
            description,
            createdAt
        );
    }

    /**
     * Copies the mutable fields (status, category) from the domain object.
     */
    void updateFromDomain(Transaction transaction) {
        this.status = transaction.getStatus();
        this.categoryId = transaction.getCategoryId();
    }
}
