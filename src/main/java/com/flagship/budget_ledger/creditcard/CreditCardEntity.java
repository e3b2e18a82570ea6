package com.flagship.budget_ledger.creditcard;

import com.flagship.budget_ledger.money.CurrencyCode;
import com.flagship.budget_ledger.money.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "credit_cards",
    indexes = {
        @Index(name = "idx_credit_cards_budget", columnList = "budget_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CreditCardEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "budget_id", nullable = false, updatable = false)
    private UUID budgetId;

    @Column(nullable = false)
    private String name;

    @Column(name = "credit_limit_cents", nullable = false)
    private long creditLimitInCents;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(name = "closing_day", nullable = false)
    private int closingDay;

    @Column(name = "due_day", nullable = false)
    private int dueDay;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static CreditCardEntity fromDomain(CreditCard card) {
        return new CreditCardEntity(
            card.getId(),
            card.getBudgetId(),
            card.getName(),
            card.getCreditLimit().getAmountInCents(),
            card.getCurrency(),
            card.getClosingDay(),
            card.getDueDay(),
            null // createdAt - set by @PrePersist
        );
    }

    public CreditCard toDomain() {
        return new CreditCard(id, budgetId, name, Money.ofCents(creditLimitInCents, currency),
            closingDay, dueDay);
    }
}
