package com.flagship.fundraising_ledger.rollup;

import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Inclusive date window. The lower bound starts at midnight of {@code from};
 * the upper bound runs through 23:59:59.999 of {@code to}. Either side may
 * be open (null).
 */
@Value
public class DateRange {

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);

    LocalDate from;
    LocalDate to;

    public static DateRange unbounded() {
        return new DateRange(null, null);
    }

    public static DateRange of(LocalDate from, LocalDate to) {
        return new DateRange(from, to);
    }

    public boolean isUnbounded() {
        return from == null && to == null;
    }

    public LocalDateTime lowerBound() {
        return from != null ? from.atStartOfDay() : null;
    }

    public LocalDateTime upperBound() {
        return to != null ? to.atTime(END_OF_DAY) : null;
    }

    public boolean contains(LocalDateTime instant) {
        if (instant == null) {
            return false;
        }
        LocalDateTime lower = lowerBound();
        LocalDateTime upper = upperBound();
        return (lower == null || !instant.isBefore(lower))
                && (upper == null || !instant.isAfter(upper));
    }

    public boolean contains(LocalDate date) {
        return date != null && contains(date.atStartOfDay());
    }
}
