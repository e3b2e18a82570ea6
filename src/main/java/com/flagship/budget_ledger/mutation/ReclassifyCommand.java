package com.flagship.budget_ledger.mutation;

import lombok.Value;

import java.util.UUID;

@Value
public class ReclassifyCommand {
    UUID budgetId;
    UUID transactionId;
    UUID newCategoryId;
}
