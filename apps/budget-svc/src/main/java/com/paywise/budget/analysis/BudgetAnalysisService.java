package com.paywise.budget.analysis;

import com.paywise.budget.model.BudgetAnalysis;
import com.paywise.budget.model.BudgetCategory;
import com.paywise.budget.model.PayPeriod;
import com.paywise.budget.model.PaySchedule;
import com.paywise.budget.model.Transaction;
import com.paywise.budget.repository.BudgetCategoryRepository;
import com.paywise.budget.repository.PayScheduleRepository;
import com.paywise.budget.repository.TransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BudgetAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(BudgetAnalysisService.class);

    private final PayScheduleRepository payScheduleRepository;
    private final BudgetCategoryRepository budgetCategoryRepository;
    private final TransactionRepository transactionRepository;
    private final PayPeriodCalculator payPeriodCalculator;
    private final CategorySpendAggregator categorySpendAggregator;
    private final Clock clock;

    public BudgetAnalysisService(
            PayScheduleRepository payScheduleRepository,
            BudgetCategoryRepository budgetCategoryRepository,
            TransactionRepository transactionRepository,
            PayPeriodCalculator payPeriodCalculator,
            CategorySpendAggregator categorySpendAggregator,
            Clock clock
    ) {
        this.payScheduleRepository = payScheduleRepository;
        this.budgetCategoryRepository = budgetCategoryRepository;
        this.transactionRepository = transactionRepository;
        this.payPeriodCalculator = payPeriodCalculator;
        this.categorySpendAggregator = categorySpendAggregator;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public BudgetAnalysis runBudgetAnalysis() {
        return runBudgetAnalysis(LocalDate.now(clock));
    }

    @Transactional(readOnly = true)
    public BudgetAnalysis runBudgetAnalysis(LocalDate asOf) {
        if (asOf == null) {
            throw new InvalidAnalysisArgumentException("asOf date must be provided");
        }
        PaySchedule schedule = AnalysisInputs.fetch("pay schedule", payScheduleRepository::findCurrent)
                .orElseThrow(MissingPayScheduleException::new);
        PayPeriod period = payPeriodCalculator.currentPeriod(schedule, asOf);
        List<BudgetCategory> categories = AnalysisInputs.fetch("active budget categories", budgetCategoryRepository::findActive);
        List<Transaction> transactions = AnalysisInputs.fetch(
                "transactions " + period.startDate() + ".." + period.endDate(),
                () -> transactionRepository.findByDateRange(period.startDate(), period.endDate()));

        Map<Long, CategorySpend> spendByCategory = categorySpendAggregator.aggregate(period, categories, transactions);
        List<BudgetAnalysis.CategoryBudget> rows = new ArrayList<>(spendByCategory.size());
        BigDecimal totalMonthly = BigDecimal.ZERO;
        BigDecimal totalAllocated = BigDecimal.ZERO;
        BigDecimal totalSpent = BigDecimal.ZERO;
        for (CategorySpend spend : spendByCategory.values()) {
            BudgetCategory category = spend.category();
            rows.add(new BudgetAnalysis.CategoryBudget(
                    category.id(),
                    category.name(),
                    category.color(),
                    category.allocatedAmount(),
                    spend.periodBudget(),
                    spend.spent(),
                    spend.periodBudget().subtract(spend.spent()),
                    spend.matchingTransactions().size()
            ));
            totalMonthly = totalMonthly.add(category.allocatedAmount());
            totalAllocated = totalAllocated.add(spend.periodBudget());
            totalSpent = totalSpent.add(spend.spent());
        }
        log.info("Budget analysis for {}..{}: categories={}, allocated={}, spent={}",
                period.startDate(), period.endDate(), rows.size(), totalAllocated, totalSpent);

        return new BudgetAnalysis(
                period,
                schedule.frequency().value(),
                rows,
                new BudgetAnalysis.Totals(totalMonthly, totalAllocated, totalSpent, totalAllocated.subtract(totalSpent))
        );
    }
}
