package com.flagship.budget_ledger.category;

public enum CategoryType {
    NEED,
    WANT,
    PRIORITY
}
