package com.flagship.budget_ledger.mutation;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Pays a credit card bill from an account. The payment is recorded as an EXPENSE
 * in {@code categoryId}; {@code paymentDate} defaults to today.
 */
@Value
@Builder
public class PayBillCommand {
    UUID budgetId;
    UUID billId;
    UUID payingAccountId;
    UUID categoryId;
    LocalDate paymentDate;
    String idempotencyKey;
}
