package com.paywise.budget.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record OverspendingAnalysis(
        List<OverspendingPeriod> periods,
        OverspendingSummary summary,
        String payFrequency
) {
    public OverspendingAnalysis {
        periods = List.copyOf(periods);
    }

    public record OverspendingPeriod(
            LocalDate startDate,
            LocalDate endDate,
            BigDecimal totalBudget,
            BigDecimal totalSpent,
            BigDecimal overspent,
            List<CategoryOverspending> categories,
            List<Transaction> biggestTransactions
    ) {
        public OverspendingPeriod {
            if (overspent.signum() < 0) {
                throw new IllegalArgumentException("period overspent must not be negative");
            }
            categories = List.copyOf(categories);
            biggestTransactions = List.copyOf(biggestTransactions);
        }
    }

    public record CategoryOverspending(
            Long categoryId,
            String name,
            String color,
            BigDecimal budgetAmount,
            BigDecimal spent,
            BigDecimal overspent,
            BigDecimal overspentPercentage,
            List<Transaction> matchingTransactions
    ) {
        public CategoryOverspending {
            if (overspent.signum() < 0 || overspentPercentage.signum() < 0) {
                throw new IllegalArgumentException("overspending figures must not be negative for category " + categoryId);
            }
            matchingTransactions = List.copyOf(matchingTransactions);
        }
    }

    public record OverspendingSummary(
            BigDecimal totalOverspent,
            BigDecimal averageOverspent,
            int periodsAnalyzed,
            List<ProblematicCategory> problematicCategories
    ) {
        public OverspendingSummary {
            problematicCategories = List.copyOf(problematicCategories);
        }
    }

    public record ProblematicCategory(
            Long categoryId,
            String name,
            String color,
            BigDecimal totalOverspent,
            int occurrences,
            BigDecimal averageOverspent
    ) {
    }
}
