package com.flagship.budget_ledger.envelope;

import com.flagship.budget_ledger.money.Money;
import com.flagship.budget_ledger.transaction.DateRange;
import lombok.Value;

import java.util.UUID;

/**
 * Usage of an envelope over one period.
 *
 * {@code percentage} is {@link #UNBOUNDED_PERCENTAGE} when the limit is zero and
 * something was spent; a zero limit with zero usage is 0%.
 */
@Value
public class EnvelopeUsage {

    public static final double UNBOUNDED_PERCENTAGE = Double.POSITIVE_INFINITY;

    UUID envelopeId;
    DateRange period;
    Money usage;
    Money limit;
    double percentage;

    public static EnvelopeUsage of(UUID envelopeId, DateRange period, Money usage, Money limit) {
        return new EnvelopeUsage(envelopeId, period, usage, limit, percentageOf(usage, limit));
    }

    static double percentageOf(Money usage, Money limit) {
        if (limit.isZero()) {
            return usage.isZero() ? 0.0 : UNBOUNDED_PERCENTAGE;
        }
        return usage.getAmountInCents() * 100.0 / limit.getAmountInCents();
    }

    public boolean isOverLimit() {
        return usage.isGreaterThan(limit);
    }

    /**
     * Limit left in the period; negative once over the limit.
     */
    public Money getRemaining() {
        return limit.minus(usage);
    }
}
