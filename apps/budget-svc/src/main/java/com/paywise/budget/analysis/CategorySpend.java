package com.paywise.budget.analysis;

import com.paywise.budget.model.BudgetCategory;
import com.paywise.budget.model.Transaction;
import java.math.BigDecimal;
import java.util.List;

public record CategorySpend(
        BudgetCategory category,
        BigDecimal periodBudget,
        BigDecimal spent,
        List<Transaction> matchingTransactions
) {
    public CategorySpend {
        matchingTransactions = List.copyOf(matchingTransactions);
    }
}
