package com.paywise.budget.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Budget against actual spend for a single pay period, every active category included.
 * {@code remaining} is negative for a category that went over its pro-rated allocation.
 */
public record BudgetAnalysis(
        PayPeriod period,
        String payFrequency,
        List<CategoryBudget> categories,
        Totals totals
) {
    public BudgetAnalysis {
        categories = List.copyOf(categories);
    }

    public record CategoryBudget(
            Long categoryId,
            String name,
            String color,
            BigDecimal monthlyAllocation,
            BigDecimal allocated,
            BigDecimal spent,
            BigDecimal remaining,
            int transactionCount
    ) {
    }

    public record Totals(
            BigDecimal totalMonthlyAllocated,
            BigDecimal totalAllocated,
            BigDecimal totalSpent,
            BigDecimal totalRemaining
    ) {
    }
}
