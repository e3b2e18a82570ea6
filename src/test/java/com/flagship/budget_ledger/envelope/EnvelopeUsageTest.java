package com.flagship.budget_ledger.envelope;

import com.flagship.budget_ledger.money.CurrencyCode;
import com.flagship.budget_ledger.money.Money;
import com.flagship.budget_ledger.transaction.DateRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeUsageTest {

    private static final DateRange MARCH = DateRange.ofMonth(YearMonth.of(2026, 3));

    private static EnvelopeUsage usage(long used, long limit) {
        return EnvelopeUsage.of(UUID.randomUUID(), MARCH,
            Money.ofCents(used, CurrencyCode.BRL), Money.ofCents(limit, CurrencyCode.BRL));
    }

    @Test
    @DisplayName("90000 spent against an 80000 limit is 112.5% and over the limit")
    void overLimit() {
        EnvelopeUsage usage = usage(90_000, 80_000);

        assertEquals(112.5, usage.getPercentage(), 1e-9);
        assertTrue(usage.isOverLimit());
        assertEquals(Money.ofCents(-10_000, CurrencyCode.BRL), usage.getRemaining());
    }

    @Test
    void exactlyAtLimitIsNotOver() {
        EnvelopeUsage usage = usage(80_000, 80_000);

        assertEquals(100.0, usage.getPercentage(), 1e-9);
        assertFalse(usage.isOverLimit());
    }

    @Test
    @DisplayName("A zero limit is unbounded once anything is spent")
    void zeroLimit() {
        assertEquals(0.0, usage(0, 0).getPercentage());
        assertEquals(EnvelopeUsage.UNBOUNDED_PERCENTAGE, usage(1, 0).getPercentage());
        assertTrue(Double.isInfinite(usage(1, 0).getPercentage()));
    }
}
