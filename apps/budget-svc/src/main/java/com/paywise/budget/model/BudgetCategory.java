package com.paywise.budget.model;

import java.math.BigDecimal;

public record BudgetCategory(
        Long id,
        String name,
        String color,
        BigDecimal allocatedAmount,
        boolean active
) {
    public BudgetCategory {
        if (id == null) {
            throw new IllegalArgumentException("category id must be provided");
        }
        // absent allocations are read as zero
        if (allocatedAmount == null) {
            allocatedAmount = BigDecimal.ZERO;
        }
        if (allocatedAmount.signum() < 0) {
            throw new IllegalArgumentException("allocatedAmount must not be negative for category " + id);
        }
    }
}
