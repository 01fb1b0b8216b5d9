package com.paywise.budget.model;

import com.paywise.budget.analysis.InvalidPayFrequencyException;
import java.util.Locale;

public enum PayFrequency {
    WEEKLY("weekly", 7),
    BIWEEKLY("biweekly", 14);

    private final String value;
    private final int days;

    PayFrequency(String value, int days) {
        this.value = value;
        this.days = days;
    }

    public String value() {
        return value;
    }

    public int days() {
        return days;
    }

    public static PayFrequency fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidPayFrequencyException("Frequency must be either \"weekly\" or \"biweekly\"");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (PayFrequency frequency : values()) {
            if (frequency.value.equals(normalized)) {
                return frequency;
            }
        }
        throw new InvalidPayFrequencyException("Unsupported pay frequency '" + raw + "'; expected \"weekly\" or \"biweekly\"");
    }
}
