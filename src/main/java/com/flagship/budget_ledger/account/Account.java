package com.flagship.budget_ledger.account;

import com.flagship.budget_ledger.money.CurrencyCode;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for an Account.
 *
 * Holds no balance: the balance is derived from the account's transactions by
 * {@link AccountBalanceCalculator}.
 */
@Value
public class Account {
    UUID id;
    UUID budgetId;
    String name;
    AccountType type;
    CurrencyCode currency;
    Instant createdAt;

    public boolean belongsTo(UUID budgetId) {
        return this.budgetId.equals(budgetId);
    }
}
