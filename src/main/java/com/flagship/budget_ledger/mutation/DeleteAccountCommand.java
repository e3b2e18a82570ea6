package com.flagship.budget_ledger.mutation;

import lombok.Value;

import java.util.UUID;

@Value
public class DeleteAccountCommand {
    UUID budgetId;
    UUID accountId;
}
