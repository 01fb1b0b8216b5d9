package com.paywise.budget.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record OverspendingAnalysisResponseDto(
        List<Period> periods,
        Summary summary,
        String payFrequency,
        String traceId
) {
    public record Period(
            LocalDate startDate,
            LocalDate endDate,
            BigDecimal totalBudget,
            BigDecimal totalSpent,
            BigDecimal overspent,
            List<CategoryOverspending> categories,
            List<TransactionDto> biggestTransactions
    ) {
    }

    public record CategoryOverspending(
            Long id,
            String name,
            String color,
            BigDecimal budgetAmount,
            BigDecimal spent,
            BigDecimal overspent,
            BigDecimal overspentPercentage,
            List<TransactionDto> transactions
    ) {
    }

    public record TransactionDto(
            Long id,
            LocalDate date,
            String name,
            BigDecimal amount,
            Long categoryId,
            String notes
    ) {
    }

    public record Summary(
            BigDecimal totalOverspent,
            BigDecimal averageOverspent,
            int periodsAnalyzed,
            List<ProblematicCategory> problematicCategories
    ) {
    }

    public record ProblematicCategory(
            Long id,
            String name,
            String color,
            BigDecimal totalOverspent,
            int occurrences,
            BigDecimal averageOverspent
    ) {
    }
}
