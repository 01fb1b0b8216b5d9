package com.paywise.budget.analysis;

import com.paywise.budget.model.BudgetCategory;
import com.paywise.budget.model.OverspendingAnalysis;
import com.paywise.budget.model.PayPeriod;
import com.paywise.budget.model.Transaction;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class PeriodOverspendingAnalyzer {

    static final int BIGGEST_TRANSACTIONS_LIMIT = 10;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CategorySpendAggregator categorySpendAggregator;

    public PeriodOverspendingAnalyzer(CategorySpendAggregator categorySpendAggregator) {
        this.categorySpendAggregator = categorySpendAggregator;
    }

    public OverspendingAnalysis.OverspendingPeriod analyze(PayPeriod period, List<BudgetCategory> categories, List<Transaction> transactionsInPeriod) {
        List<Transaction> transactions = transactionsInPeriod == null ? List.of() : transactionsInPeriod;
        Map<Long, CategorySpend> spendByCategory = categorySpendAggregator.aggregate(period, categories, transactions);

        BigDecimal totalBudget = BigDecimal.ZERO;
        BigDecimal totalSpent = BigDecimal.ZERO;
        List<OverspendingAnalysis.CategoryOverspending> overspending = new ArrayList<>();
        for (CategorySpend spend : spendByCategory.values()) {
            totalBudget = totalBudget.add(spend.periodBudget());
            totalSpent = totalSpent.add(spend.spent());
            BigDecimal overspent = floorAtZero(spend.spent().subtract(spend.periodBudget()));
            if (overspent.signum() > 0) {
                overspending.add(toCategoryOverspending(spend, overspent));
            }
        }
        overspending.sort(Comparator.comparing(OverspendingAnalysis.CategoryOverspending::overspent).reversed()
                .thenComparing(OverspendingAnalysis.CategoryOverspending::categoryId));

        return new OverspendingAnalysis.OverspendingPeriod(
                period.startDate(),
                period.endDate(),
                totalBudget,
                totalSpent,
                floorAtZero(totalSpent.subtract(totalBudget)),
                overspending,
                biggestTransactions(period, transactions)
        );
    }

    private OverspendingAnalysis.CategoryOverspending toCategoryOverspending(CategorySpend spend, BigDecimal overspent) {
        BigDecimal budget = spend.periodBudget();
        BigDecimal percentage = budget.signum() > 0
                ? overspent.divide(budget, MathContext.DECIMAL128).multiply(HUNDRED)
                : BigDecimal.ZERO;
        BudgetCategory category = spend.category();
        return new OverspendingAnalysis.CategoryOverspending(
                category.id(),
                category.name(),
                category.color(),
                budget,
                spend.spent(),
                overspent,
                percentage,
                spend.matchingTransactions()
        );
    }

    // List.sort is stable, so equal magnitudes keep the order the store returned them in
    private List<Transaction> biggestTransactions(PayPeriod period, List<Transaction> transactions) {
        List<Transaction> byMagnitude = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            if (period.contains(tx.date())) {
                byMagnitude.add(tx.withAmount(tx.magnitude()));
            }
        }
        byMagnitude.sort(Comparator.comparing(Transaction::amount).reversed());
        return byMagnitude.subList(0, Math.min(BIGGEST_TRANSACTIONS_LIMIT, byMagnitude.size()));
    }

    private static BigDecimal floorAtZero(BigDecimal value) {
        return value.signum() > 0 ? value : BigDecimal.ZERO;
    }
}
