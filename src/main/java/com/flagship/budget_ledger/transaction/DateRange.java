package com.flagship.budget_ledger.transaction;

import lombok.Value;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Objects;

/**
 * Closed interval of calendar days, both ends inclusive.
 *
 * Used as the "period" parameter of every range query and derived computation;
 * the ledger never assumes calendar months on its own.
 */
@Value
public class DateRange {
    LocalDate start;
    LocalDate end;

    private DateRange(LocalDate start, LocalDate end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException(
                String.format("Range end %s is before start %s", end, start));
        }
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    public static DateRange ofMonth(YearMonth month) {
        return new DateRange(month.atDay(1), month.atEndOfMonth());
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }
}
