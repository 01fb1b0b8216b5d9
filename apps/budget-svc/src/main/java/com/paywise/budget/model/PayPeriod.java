package com.paywise.budget.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Date interval inclusive on both ends.
 */
public record PayPeriod(LocalDate startDate, LocalDate endDate) {

    public PayPeriod {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("startDate and endDate must be provided");
        }
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate " + endDate + " is before startDate " + startDate);
        }
    }

    public int lengthInDays() {
        return (int) ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(startDate) && !date.isAfter(endDate);
    }
}
