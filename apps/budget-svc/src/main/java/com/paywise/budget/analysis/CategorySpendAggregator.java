package com.paywise.budget.analysis;

import com.paywise.budget.model.BudgetCategory;
import com.paywise.budget.model.PayPeriod;
import com.paywise.budget.model.Transaction;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class CategorySpendAggregator {

    static final BigDecimal DAYS_PER_MONTH = BigDecimal.valueOf(30);

    public Map<Long, CategorySpend> aggregate(PayPeriod period, List<BudgetCategory> categories, List<Transaction> transactions) {
        Objects.requireNonNull(period, "period");
        List<Transaction> inPeriod = transactions == null ? List.of() : transactions.stream()
                .filter(tx -> period.contains(tx.date()))
                .toList();
        int daysInPeriod = period.lengthInDays();

        Map<Long, CategorySpend> result = new LinkedHashMap<>();
        if (categories == null) {
            return result;
        }
        for (BudgetCategory category : categories) {
            if (!category.active()) {
                continue;
            }
            List<Transaction> matching = inPeriod.stream()
                    .filter(tx -> category.id().equals(tx.categoryId()))
                    .toList();
            BigDecimal spent = matching.stream()
                    .map(Transaction::magnitude)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            result.put(category.id(), new CategorySpend(category, proRate(category.allocatedAmount(), daysInPeriod), spent, matching));
        }
        return result;
    }

    static BigDecimal proRate(BigDecimal monthlyAllocation, int daysInPeriod) {
        if (monthlyAllocation == null || monthlyAllocation.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal daily = monthlyAllocation.divide(DAYS_PER_MONTH, MathContext.DECIMAL128);
        return daily.multiply(BigDecimal.valueOf(daysInPeriod));
    }
}
