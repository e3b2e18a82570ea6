package com.flagship.budget_ledger.money;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    @DisplayName("Arithmetic stays in minor units")
    void arithmeticInCents() {
        Money a = Money.ofCents(10_000, CurrencyCode.BRL);
        Money b = Money.ofCents(3_000, CurrencyCode.BRL);

        assertEquals(Money.ofCents(13_000, CurrencyCode.BRL), a.plus(b));
        assertEquals(Money.ofCents(7_000, CurrencyCode.BRL), a.minus(b));
        assertEquals(Money.ofCents(-3_000, CurrencyCode.BRL), b.negate());
        assertTrue(b.negate().isNegative());
        assertTrue(a.isGreaterThan(b));
        assertTrue(b.isLessThan(a));
        assertTrue(Money.zero(CurrencyCode.BRL).isZero());
    }

    @Test
    @DisplayName("Mixing currencies is rejected")
    void currencyMismatch() {
        Money brl = Money.ofCents(100, CurrencyCode.BRL);
        Money usd = Money.ofCents(100, CurrencyCode.USD);

        assertThrows(IllegalArgumentException.class, () -> brl.plus(usd));
        assertThrows(IllegalArgumentException.class, () -> brl.compareTo(usd));
    }

    @Test
    void overflowIsDetected() {
        Money max = Money.ofCents(Long.MAX_VALUE, CurrencyCode.BRL);
        assertThrows(ArithmeticException.class, () -> max.plus(Money.ofCents(1, CurrencyCode.BRL)));
    }

    @Test
    void formatsWithTwoDecimals() {
        assertEquals("BRL -12.05", Money.ofCents(-1_205, CurrencyCode.BRL).toString());
        assertEquals("USD 0.07", Money.ofCents(7, CurrencyCode.USD).toString());
    }
}
