package com.flagship.budget_ledger.envelope;

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
    name = "envelopes",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_envelope_budget_category", columnNames = {"budget_id", "category_id"})
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EnvelopeEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "budget_id", nullable = false, updatable = false)
    private UUID budgetId;

    @Column(name = "category_id", nullable = false, updatable = false)
    private UUID categoryId;

    @Column(name = "limit_cents", nullable = false)
    private long limitInCents;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static EnvelopeEntity fromDomain(Envelope envelope) {
        return new EnvelopeEntity(
            envelope.getId(),
            envelope.getBudgetId(),
            envelope.getCategoryId(),
            envelope.getLimit().getAmountInCents(),
            envelope.getLimit().getCurrency(),
            envelope.isActive(),
            null // createdAt - set by @PrePersist
        );
    }

    public Envelope toDomain() {
        return new Envelope(id, budgetId, categoryId, Money.ofCents(limitInCents, currency), active);
    }
}
