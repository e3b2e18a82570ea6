package com.flagship.budget_ledger.transaction;

/**
 * Direction of a transaction's effect. Amounts are always positive; the type
 * (and for transfers the {@link TransferDirection}) carries the sign.
 */
public enum TransactionType {
    INCOME,
    EXPENSE,
    TRANSFER
}
