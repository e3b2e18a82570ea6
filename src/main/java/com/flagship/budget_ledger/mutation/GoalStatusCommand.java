package com.flagship.budget_ledger.mutation;

import com.flagship.budget_ledger.goal.GoalStatus;
import lombok.Value;

import java.util.UUID;

@Value
public class GoalStatusCommand {
    UUID budgetId;
    UUID goalId;
    GoalStatus newStatus;
}
