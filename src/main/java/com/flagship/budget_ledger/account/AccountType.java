package com.flagship.budget_ledger.account;

/**
 * Where the money of an account is physically held.
 */
public enum AccountType {
    CHECKING,
    SAVINGS,
    CASH,
    DIGITAL_WALLET,
    INVESTMENT,
    OTHER
}
