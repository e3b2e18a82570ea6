package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.money.Money;
import lombok.Value;

import java.util.UUID;

@Value
public class GoalAmountCommand {
    UUID budgetId;
    UUID goalId;
    Money amount;
}
