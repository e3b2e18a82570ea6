package com.flagship.budget_ledger.money;

import lombok.Value;

import java.util.Objects;

/**
 * Fixed-point amount of money expressed in minor currency units (cents).
 *
 * Immutable. Arithmetic and comparison are only defined between values of the
 * same currency; mixing currencies is a programming error and throws
 * {@link IllegalArgumentException}.
 */
@Value
public class Money implements Comparable<Money> {
    long amountInCents;
    CurrencyCode currency;

    private Money(long amountInCents, CurrencyCode currency) {
        this.amountInCents = amountInCents;
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public static Money ofCents(long amountInCents, CurrencyCode currency) {
        return new Money(amountInCents, currency);
    }

    public static Money zero(CurrencyCode currency) {
        return new Money(0L, currency);
    }

    public Money plus(Money other) {
        requireSameCurrency(other);
        return new Money(Math.addExact(amountInCents, other.amountInCents), currency);
    }

    public Money minus(Money other) {
        requireSameCurrency(other);
        return new Money(Math.subtractExact(amountInCents, other.amountInCents), currency);
    }

    public Money negate() {
        return new Money(Math.negateExact(amountInCents), currency);
    }

    public boolean isZero() {
        return amountInCents == 0L;
    }

    public boolean isPositive() {
        return amountInCents > 0L;
    }

    public boolean isNegative() {
        return amountInCents < 0L;
    }

    public boolean isGreaterThan(Money other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Money other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Money other) {
        requireSameCurrency(other);
        return Long.compare(amountInCents, other.amountInCents);
    }

    private void requireSameCurrency(Money other) {
        Objects.requireNonNull(other, "other");
        if (currency != other.currency) {
            throw new IllegalArgumentException(
                String.format("Currency mismatch: %s vs %s", currency, other.currency));
        }
    }

    @Override
    public String toString() {
        long abs = Math.abs(amountInCents);
        return String.format("%s %s%d.%02d", currency, amountInCents < 0 ? "-" : "",
            abs / 100, abs % 100);
    }
}
