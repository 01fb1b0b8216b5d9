package com.paywise.budget.model;

import java.time.LocalDate;

/**
 * Recurring pay anchor. Every date {@code lastPayDate + k * frequency} is a pay date
 * and opens a pay period of {@code frequency.days()} days.
 */
public record PaySchedule(LocalDate lastPayDate, PayFrequency frequency) {

    public PaySchedule {
        if (lastPayDate == null) {
            throw new IllegalArgumentException("lastPayDate must be provided");
        }
        if (frequency == null) {
            throw new IllegalArgumentException("frequency must be provided");
        }
    }
}
