package com.flagship.budget_ledger.mutation;

import lombok.Value;

import java.util.UUID;

@Value
public class TransferGoalCommand {
    UUID budgetId;
    UUID goalId;
    UUID newAccountId;
}
