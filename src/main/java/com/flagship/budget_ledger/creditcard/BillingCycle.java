package com.flagship.budget_ledger.creditcard;

import com.flagship.budget_ledger.transaction.DateRange;
import lombok.Value;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * One billing cycle of a credit card, identified by the month its bill closes in.
 *
 * Rules:
 * - A purchase dated on or before the closing day belongs to the bill closing in
 *   the same month; a later purchase belongs to the bill closing the next month.
 * - Closing and due days are clamped to the length of their month (day 31 closes
 *   on Feb 28/29).
 * - The cycle covers the days after the previous closing date up to and
 *   including this closing date.
 * - The due date falls in the closing month when the due day comes after the
 *   closing day, otherwise in the following month. It is always after the
 *   closing date.
 */
@Value
public class BillingCycle {
    YearMonth period;
    LocalDate closingDate;
    LocalDate dueDate;
    DateRange range;

    public static BillingCycle forPurchase(CreditCard card, LocalDate purchaseDate) {
        return forPurchase(card.getClosingDay(), card.getDueDay(), purchaseDate);
    }

    public static BillingCycle forPurchase(int closingDay, int dueDay, LocalDate purchaseDate) {
        YearMonth month = YearMonth.from(purchaseDate);
        YearMonth period = purchaseDate.getDayOfMonth() <= closingDay ? month : month.plusMonths(1);
        return forPeriod(closingDay, dueDay, period);
    }

    public static BillingCycle forPeriod(CreditCard card, YearMonth period) {
        return forPeriod(card.getClosingDay(), card.getDueDay(), period);
    }

    public static BillingCycle forPeriod(int closingDay, int dueDay, YearMonth period) {
        requireDay("closing", closingDay);
        requireDay("due", dueDay);
        LocalDate closingDate = clamp(period, closingDay);
        LocalDate previousClosingDate = clamp(period.minusMonths(1), closingDay);
        LocalDate dueDate = dueDay > closingDay
            ? clamp(period, dueDay)
            : clamp(period.plusMonths(1), dueDay);
        if (!dueDate.isAfter(closingDate)) {
            // due day clamped onto the closing date in a short month
            dueDate = clamp(period.plusMonths(1), dueDay);
        }
        return new BillingCycle(period, closingDate, dueDate,
            DateRange.of(previousClosingDate.plusDays(1), closingDate));
    }

    public boolean contains(LocalDate date) {
        return range.contains(date);
    }

    private static LocalDate clamp(YearMonth month, int day) {
        return month.atDay(Math.min(day, month.lengthOfMonth()));
    }

    private static void requireDay(String label, int day) {
        if (day < 1 || day > 31) {
            throw new IllegalArgumentException(label + " day must be between 1 and 31: " + day);
        }
    }
}
