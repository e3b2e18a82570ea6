package com.flagship.budget_ledger.transaction;

/**
 * Which leg of an account-to-account transfer a TRANSFER transaction is.
 */
public enum TransferDirection {
    /** Credit leg, increases the destination account. */
    IN,
    /** Debit leg, decreases the source account. */
    OUT
}
