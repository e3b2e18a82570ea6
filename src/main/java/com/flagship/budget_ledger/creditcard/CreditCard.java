package com.flagship.budget_ledger.creditcard;

import com.flagship.budget_ledger.money.CurrencyCode;
import com.flagship.budget_ledger.money.Money;
import lombok.Value;

import java.util.UUID;

/**
 * Credit card master data. Holds no transactions; purchases reference the card
 * and are grouped into {@link CreditCardBill}s by {@link BillingCycle}.
 */
@Value
public class CreditCard {
    UUID id;
    UUID budgetId;
    String name;
    Money creditLimit;
    int closingDay;
    int dueDay;

    public CurrencyCode getCurrency() {
        return creditLimit.getCurrency();
    }

    public boolean belongsTo(UUID budgetId) {
        return this.budgetId.equals(budgetId);
    }
}
