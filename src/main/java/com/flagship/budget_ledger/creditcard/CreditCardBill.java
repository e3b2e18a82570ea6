package com.flagship.budget_ledger.creditcard;

import com.flagship.budget_ledger.error.ImmutableBillException;
import com.flagship.budget_ledger.error.ValidationException;
import com.flagship.budget_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

/**
 * Aggregated bill of one card for one billing cycle.
 *
 * {@code amount} is derived: it is always replaced by a full recomputation over
 * the cycle's transactions, never adjusted incrementally. Only the status and
 * {@code paidAt} move independently, and only forward along {@link BillStatus}.
 */
@Value
public class CreditCardBill {
    UUID id;
    UUID budgetId;
    UUID creditCardId;
    YearMonth period;
    LocalDate closingDate;
    LocalDate dueDate;
    Money amount;
    BillStatus status;
    Instant paidAt;

    public static CreditCardBill create(CreditCard card, BillingCycle cycle, Money amount, BillStatus status) {
        return new CreditCardBill(
            UUID.randomUUID(),
            card.getBudgetId(),
            card.getId(),
            cycle.getPeriod(),
            cycle.getClosingDate(),
            cycle.getDueDate(),
            amount,
            status,
            null
        );
    }

    public boolean isPaid() {
        return status == BillStatus.PAID;
    }

    /**
     * Replaces the derived total.
     *
     * @throws ImmutableBillException if the bill is PAID and the total would change
     */
    public CreditCardBill withAmount(Money recomputed) {
        if (isPaid() && !recomputed.equals(amount)) {
            throw new ImmutableBillException(String.format(
                "Bill %s for %s is already paid; total cannot change from %s to %s",
                id, period, amount, recomputed));
        }
        return new CreditCardBill(id, budgetId, creditCardId, period, closingDate, dueDate,
            recomputed, status, paidAt);
    }

    public CreditCardBill close() {
        return transitionTo(BillStatus.CLOSED, paidAt);
    }

    public CreditCardBill markOverdue() {
        return transitionTo(BillStatus.OVERDUE, paidAt);
    }

    public CreditCardBill markPaid(Instant when) {
        return transitionTo(BillStatus.PAID, when);
    }

    private CreditCardBill transitionTo(BillStatus target, Instant newPaidAt) {
        if (status == BillStatus.PAID) {
            throw new ImmutableBillException("Bill " + id + " is already paid");
        }
        if (!status.canTransitionTo(target)) {
            throw new ValidationException(String.format(
                "Cannot move bill %s from %s to %s", id, status, target));
        }
        return new CreditCardBill(id, budgetId, creditCardId, period, closingDate, dueDate,
            amount, target, newPaidAt);
    }
}
