package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.transaction.TransactionStatus;
import lombok.Value;

import java.util.UUID;

@Value
public class TransactionStatusCommand {
    UUID budgetId;
    UUID transactionId;
    TransactionStatus newStatus;
}
