package com.flagship.budget_ledger.category;

import lombok.Value;

import java.util.UUID;

/**
 * Spending category. Maintained outside the ledger; read here to validate
 * references and to match envelopes.
 */
@Value
public class Category {
    UUID id;
    UUID budgetId;
    String name;
    CategoryType type;
    boolean active;
}
