package com.flagship.budget_ledger.mutation;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * What an account deletion removed, and which bills it recomputed.
 */
@Value
public class AccountDeletion {
    UUID accountId;
    int deletedTransactions;
    int deletedGoals;
    List<UUID> recomputedBillIds;
}
