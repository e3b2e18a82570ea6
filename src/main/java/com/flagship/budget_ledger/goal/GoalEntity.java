package com.flagship.budget_ledger.goal;

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
 * JPA Entity for goals.
 *
 * The table carries CHECK (current_amount_cents BETWEEN 0 AND target_amount_cents);
 * {@code @Version} detects concurrent writers that slipped past the account lock.
 */
@Entity
@Table(
    name = "goals",
    indexes = {
        @Index(name = "idx_goals_source_account_status", columnList = "source_account_id, status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GoalEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "budget_id", nullable = false, updatable = false)
    private UUID budgetId;

    @Column(nullable = false)
    private String name;

    @Column(name = "target_amount_cents", nullable = false, updatable = false)
    private long targetAmountInCents;

    @Column(name = "current_amount_cents", nullable = false)
    private long currentAmountInCents;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(name = "target_date", nullable = false, updatable = false)
    private LocalDate targetDate;

    @Column(name = "source_account_id", nullable = false)
    private UUID sourceAccountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private GoalStatus status;

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

    static GoalEntity fromDomain(Goal goal) {
        return new GoalEntity(
            goal.getId(),
            goal.getBudgetId(),
            goal.getName(),
            goal.getTargetAmount().getAmountInCents(),
            goal.getCurrentAmount().getAmountInCents(),
            goal.getTargetAmount().getCurrency(),
            goal.getTargetDate(),
            goal.getSourceAccountId(),
            goal.getStatus(),
            0L,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public Goal toDomain() {
        return new Goal(
            id,
            budgetId,
            name,
            Money.ofCents(targetAmountInCents, currency),
            Money.ofCents(currentAmountInCents, currency),
            targetDate,
            sourceAccountId,
            status
        );
    }

    /**
     * Copies the fields that change after creation: current amount, source account, status.
     */
    void updateFromDomain(Goal goal) {
        this.currentAmountInCents = goal.getCurrentAmount().getAmountInCents();
        this.sourceAccountId = goal.getSourceAccountId();
        this.status = goal.getStatus();
    }
}
