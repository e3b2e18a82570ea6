package com.flagship.budget_ledger.account;

import com.flagship.budget_ledger.money.CurrencyCode;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA Entity for Account persistence.
 *
 * The row doubles as the per-account mutual-exclusion point: mutation units take
 * a PESSIMISTIC_WRITE lock on it before reading balances they are about to
 * change (see {@link AccountRepository#findByIdForUpdate(UUID)}).
 */
@Entity
@Table(
    name = "accounts",
    indexes = {
        @Index(name = "idx_accounts_budget", columnList = "budget_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "budget_id", nullable = false, updatable = false)
    private UUID budgetId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false)
    private AccountType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

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

    static AccountEntity create(UUID budgetId, String name, AccountType type, CurrencyCode currency) {
        return new AccountEntity(UUID.randomUUID(), budgetId, name, type, currency, 0L, null, null);
    }

    public Account toDomain() {
        return new Account(id, budgetId, name, type, currency, createdAt);
    }
}
