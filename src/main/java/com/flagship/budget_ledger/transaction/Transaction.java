package com.flagship.budget_ledger.transaction;

import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A single recorded movement of money on one account.
 *
 * Key principles:
 * - Amount is always positive; type (and transfer direction) carries the sign
 * - Status transitions follow {@link TransactionStatus}; invalid ones are rejected
 * - State changes return a new instance
 */
@Value
public class Transaction {
    UUID id;
    UUID budgetId;
    UUID accountId;
    UUID categoryId;
    UUID creditCardId;
    Money amount;
    TransactionType type;
    TransferDirection transferDirection;
    UUID transferGroupId;
    TransactionStatus status;
    LocalDate transactionDate;
    String description;
    Instant createdAt;

    public boolean isCompleted() {
        return status == TransactionStatus.COMPLETED;
    }

    public boolean isCreditCardPurchase() {
        return creditCardId != null;
    }

    /**
     * Amount with the sign of its effect on the account balance: INCOME and
     * incoming transfers are positive, EXPENSE and outgoing transfers negative.
     */
    public Money signedAmount() {
        return switch (type) {
            case INCOME -> amount;
            case EXPENSE -> amount.negate();
            case TRANSFER -> transferDirection == TransferDirection.IN ? amount : amount.negate();
        };
    }

    /**
     * @throws ValidationException if the transition is not allowed
     */
    public Transaction withStatus(TransactionStatus newStatus) {
        if (!status.canTransitionTo(newStatus)) {
            throw new ValidationException(String.format(
                "Cannot move transaction %s from %s to %s", id, status, newStatus));
        }
        return new Transaction(id, budgetId, accountId, categoryId, creditCardId, amount, type,
            transferDirection, transferGroupId, newStatus, transactionDate, description, createdAt);
    }

    /**
     * Moves the transaction to another category. Amount, account and date are untouched.
     *
     * @throws ValidationException if the transaction is cancelled
     */
    public Transaction reclassify(UUID newCategoryId) {
        if (status == TransactionStatus.CANCELLED) {
            throw new ValidationException("Cannot reclassify cancelled transaction " + id);
        }
        return new Transaction(id, budgetId, accountId, newCategoryId, creditCardId, amount, type,
            transferDirection, transferGroupId, status, transactionDate, description, createdAt);
    }
}
