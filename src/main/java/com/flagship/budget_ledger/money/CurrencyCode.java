package com.flagship.budget_ledger.money;

/**
 * Currency code enum following ISO-4217 standard.
 *
 * Accounts, goals, envelopes and cards each carry one of these. Amounts in
 * different currencies are never combined.
 */
public enum CurrencyCode {
    BRL, // Brazilian Real
    USD, // US Dollar
    EUR, // Euro
    GBP, // British Pound
    JPY  // Japanese Yen
}
