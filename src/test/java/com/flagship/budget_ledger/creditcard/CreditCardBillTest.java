package com.flagship.budget_ledger.creditcard;

import com.flagship.budget_ledger.error.ImmutableBillException;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.money.CurrencyCode;
import com.flagship.budget_ledger.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Bill state machine: OPEN -> CLOSED -> (OVERDUE) -> PAID, and PAID bills never change.
 */
class CreditCardBillTest {

    private final CreditCard card = new CreditCard(UUID.randomUUID(), UUID.randomUUID(), "Gold",
        Money.ofCents(500_000, CurrencyCode.BRL), 10, 20);

    private CreditCardBill openBill(long cents) {
        BillingCycle cycle = BillingCycle.forPurchase(card, LocalDate.of(2026, 3, 5));
        return CreditCardBill.create(card, cycle, Money.ofCents(cents, CurrencyCode.BRL), BillStatus.OPEN);
    }

    @Test
    void followsTheLifecycle() {
        Instant paidAt = Instant.parse("2026-03-18T12:00:00Z");

        CreditCardBill closed = openBill(15_000).close();
        CreditCardBill overdue = closed.markOverdue();
        CreditCardBill paid = overdue.markPaid(paidAt);

        assertEquals(BillStatus.CLOSED, closed.getStatus());
        assertEquals(BillStatus.OVERDUE, overdue.getStatus());
        assertTrue(paid.isPaid());
        assertEquals(paidAt, paid.getPaidAt());
        assertEquals(Money.ofCents(15_000, CurrencyCode.BRL), paid.getAmount());
    }

    @Test
    @DisplayName("An OPEN bill cannot be paid or marked overdue")
    void openBillCannotSkipClosing() {
        CreditCardBill open = openBill(1_000);

        assertThrows(ValidationException.class, () -> open.markPaid(Instant.now()));
        assertThrows(ValidationException.class, open::markOverdue);
    }

    @Test
    @DisplayName("A PAID bill rejects every change to its total or status")
    void paidBillIsImmutable() {
        CreditCardBill paid = openBill(1_000).close().markPaid(Instant.now());

        assertThrows(ImmutableBillException.class, () -> paid.withAmount(Money.ofCents(2_000, CurrencyCode.BRL)));
        assertThrows(ImmutableBillException.class, paid::close);
        assertThrows(ImmutableBillException.class, () -> paid.markPaid(Instant.now()));
        assertSame(paid.getStatus(), paid.withAmount(Money.ofCents(1_000, CurrencyCode.BRL)).getStatus());
    }

    @Test
    void recomputedTotalReplacesTheAmount() {
        CreditCardBill bill = openBill(1_000).withAmount(Money.ofCents(6_000, CurrencyCode.BRL));

        assertEquals(Money.ofCents(6_000, CurrencyCode.BRL), bill.getAmount());
        assertEquals(BillStatus.OPEN, bill.getStatus());
    }
}
