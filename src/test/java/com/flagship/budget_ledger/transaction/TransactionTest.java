package com.flagship.budget_ledger.transaction;

import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.money.CurrencyCode;
import com.flagship.budget_ledger.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TransactionTest {

    private static Transaction tx(TransactionType type, TransferDirection direction, TransactionStatus status) {
        return new Transaction(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), null,
            Money.ofCents(2_500, CurrencyCode.BRL), type, direction, null, status,
            LocalDate.of(2026, 3, 1), "", Instant.now());
    }

    @Test
    @DisplayName("Type and transfer direction carry the sign")
    void signedAmount() {
        assertEquals(2_500, tx(TransactionType.INCOME, null, TransactionStatus.COMPLETED)
            .signedAmount().getAmountInCents());
        assertEquals(-2_500, tx(TransactionType.EXPENSE, null, TransactionStatus.COMPLETED)
            .signedAmount().getAmountInCents());
        assertEquals(2_500, tx(TransactionType.TRANSFER, TransferDirection.IN, TransactionStatus.COMPLETED)
            .signedAmount().getAmountInCents());
        assertEquals(-2_500, tx(TransactionType.TRANSFER, TransferDirection.OUT, TransactionStatus.COMPLETED)
            .signedAmount().getAmountInCents());
    }

    @Test
    void statusMachine() {
        assertTrue(TransactionStatus.SCHEDULED.canTransitionTo(TransactionStatus.COMPLETED));
        assertTrue(TransactionStatus.SCHEDULED.canTransitionTo(TransactionStatus.OVERDUE));
        assertTrue(TransactionStatus.OVERDUE.canTransitionTo(TransactionStatus.COMPLETED));
        assertFalse(TransactionStatus.OVERDUE.canTransitionTo(TransactionStatus.CANCELLED));
        assertFalse(TransactionStatus.COMPLETED.canTransitionTo(TransactionStatus.CANCELLED));
        assertTrue(TransactionStatus.CANCELLED.allowedTransitions().isEmpty());
    }

    @Test
    void rejectsTransitionOutOfTerminalStatus() {
        Transaction completed = tx(TransactionType.EXPENSE, null, TransactionStatus.SCHEDULED)
            .withStatus(TransactionStatus.COMPLETED);

        assertTrue(completed.isCompleted());
        assertThrows(ValidationException.class, () -> completed.withStatus(TransactionStatus.SCHEDULED));
    }

    @Test
    @DisplayName("Reclassifying only moves the category")
    void reclassify() {
        Transaction original = tx(TransactionType.EXPENSE, null, TransactionStatus.COMPLETED);
        UUID newCategory = UUID.randomUUID();

        Transaction moved = original.reclassify(newCategory);

        assertEquals(newCategory, moved.getCategoryId());
        assertEquals(original.getAmount(), moved.getAmount());
        assertEquals(original.getAccountId(), moved.getAccountId());
        assertEquals(original.getTransactionDate(), moved.getTransactionDate());
        assertThrows(ValidationException.class,
            () -> tx(TransactionType.EXPENSE, null, TransactionStatus.CANCELLED).reclassify(newCategory));
    }

    @Test
    void dateRangeIsInclusive() {
        DateRange march = DateRange.ofMonth(java.time.YearMonth.of(2026, 3));

        assertTrue(march.contains(LocalDate.of(2026, 3, 1)));
        assertTrue(march.contains(LocalDate.of(2026, 3, 31)));
        assertFalse(march.contains(LocalDate.of(2026, 4, 1)));
        assertThrows(IllegalArgumentException.class,
            () -> DateRange.of(LocalDate.of(2026, 3, 2), LocalDate.of(2026, 3, 1)));
    }
}
