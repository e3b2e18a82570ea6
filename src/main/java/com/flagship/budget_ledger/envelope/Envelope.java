package com.flagship.budget_ledger.envelope;

import com.flagship.budget_ledger.money.Money;
import lombok.Value;

import java.util.UUID;

/**
 * Spending limit for one category of a budget. Usage is never stored; see
 * {@link EnvelopeUsageCalculator}.
 */
@Value
public class Envelope {
    UUID id;
    UUID budgetId;
    UUID categoryId;
    Money limit;
    boolean active;
}
