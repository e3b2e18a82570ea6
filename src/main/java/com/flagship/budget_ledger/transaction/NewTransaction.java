package com.flagship.budget_ledger.transaction;

import com.flagship.budget_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Request object for recording a transaction.
 *
 * {@code transferDirection} is required exactly when {@code type} is TRANSFER.
 * {@code creditCardId} is optional; when present the transaction is a card
 * purchase and lands on that card's bill.
 */
@Value
@Builder
public class NewTransaction {
    UUID budgetId;
    UUID accountId;
    UUID categoryId;
    UUID creditCardId;
    Money amount;
    TransactionType type;
    TransferDirection transferDirection;
    UUID transferGroupId;
    @Builder.Default
    TransactionStatus status = TransactionStatus.COMPLETED;
    LocalDate transactionDate;
    String description;
}
