package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.money.Money;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Moves money between two accounts of one budget. {@code transactionDate} defaults
 * to today; {@code idempotencyKey} is optional.
 */
@Value
@Builder
public class TransferCommand {
    UUID budgetId;
    UUID fromAccountId;
    UUID toAccountId;
    Money amount;
    UUID categoryId;
    LocalDate transactionDate;
    String description;
    String idempotencyKey;
}
