package com.paywise.budget.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record BudgetAnalysisResponseDto(
        List<Category> categories,
        Summary summary,
        String traceId
) {
    public record Category(
            Long id,
            String name,
            String color,
            BigDecimal fullMonthAmount,
            BigDecimal allocatedAmount,
            BigDecimal spent,
            BigDecimal remaining,
            int transactionCount
    ) {
    }

    public record Summary(
            LocalDate startDate,
            LocalDate endDate,
            int daysInPeriod,
            String payFrequency,
            BigDecimal totalMonthlyAllocated,
            BigDecimal totalAllocated,
            BigDecimal totalSpent,
            BigDecimal totalRemaining
    ) {
    }
}
