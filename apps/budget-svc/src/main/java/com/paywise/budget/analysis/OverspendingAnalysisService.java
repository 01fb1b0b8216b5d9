package com.paywise.budget.analysis;

import com.paywise.budget.model.BudgetCategory;
import com.paywise.budget.model.OverspendingAnalysis;
import com.paywise.budget.model.PayPeriod;
import com.paywise.budget.model.PaySchedule;
import com.paywise.budget.model.Transaction;
import com.paywise.budget.repository.BudgetCategoryRepository;
import com.paywise.budget.repository.PayScheduleRepository;
import com.paywise.budget.repository.TransactionRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class OverspendingAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(OverspendingAnalysisService.class);

    private final PayScheduleRepository payScheduleRepository;
    private final BudgetCategoryRepository budgetCategoryRepository;
    private final TransactionRepository transactionRepository;
    private final PayPeriodCalculator payPeriodCalculator;
    private final PeriodOverspendingAnalyzer periodOverspendingAnalyzer;
    private final OverspendingSummarizer overspendingSummarizer;
    private final Clock clock;

    public OverspendingAnalysisService(
            PayScheduleRepository payScheduleRepository,
            BudgetCategoryRepository budgetCategoryRepository,
            TransactionRepository transactionRepository,
            PayPeriodCalculator payPeriodCalculator,
            PeriodOverspendingAnalyzer periodOverspendingAnalyzer,
            OverspendingSummarizer overspendingSummarizer,
            Clock clock
    ) {
        this.payScheduleRepository = payScheduleRepository;
        this.budgetCategoryRepository = budgetCategoryRepository;
        this.transactionRepository = transactionRepository;
        this.payPeriodCalculator = payPeriodCalculator;
        this.periodOverspendingAnalyzer = periodOverspendingAnalyzer;
        this.overspendingSummarizer = overspendingSummarizer;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public OverspendingAnalysis runOverspendingAnalysis(int periodsRequested) {
        return runOverspendingAnalysis(periodsRequested, LocalDate.now(clock));
    }

    @Transactional(readOnly = true)
    public OverspendingAnalysis runOverspendingAnalysis(int periodsRequested, LocalDate asOf) {
        if (periodsRequested <= 0) {
            throw new InvalidAnalysisArgumentException("periods must be a positive integer, got " + periodsRequested);
        }
        if (asOf == null) {
            throw new InvalidAnalysisArgumentException("asOf date must be provided");
        }
        PaySchedule schedule = AnalysisInputs.fetch("pay schedule", payScheduleRepository::findCurrent)
                .orElseThrow(MissingPayScheduleException::new);
        List<BudgetCategory> categories = AnalysisInputs.fetch("active budget categories", budgetCategoryRepository::findActive).stream()
                .filter(BudgetCategory::active)
                .toList();
        List<PayPeriod> payPeriods = payPeriodCalculator.recentCompletedPeriods(schedule, periodsRequested, asOf);
        log.info("Running overspending analysis: periods={}, frequency={}, asOf={}, activeCategories={}",
                periodsRequested, schedule.frequency().value(), asOf, categories.size());

        List<OverspendingAnalysis.OverspendingPeriod> analyzed = new ArrayList<>(payPeriods.size());
        for (PayPeriod period : payPeriods) {
            List<Transaction> transactions = AnalysisInputs.fetch(
                    "transactions " + period.startDate() + ".." + period.endDate(),
                    () -> transactionRepository.findByDateRange(period.startDate(), period.endDate()));
            OverspendingAnalysis.OverspendingPeriod result = periodOverspendingAnalyzer.analyze(period, categories, transactions);
            log.debug("Analyzed period {}..{}: transactions={}, budget={}, spent={}, overspent={}, overspendingCategories={}",
                    period.startDate(), period.endDate(), transactions.size(), result.totalBudget(),
                    result.totalSpent(), result.overspent(), result.categories().size());
            analyzed.add(result);
        }

        OverspendingAnalysis.OverspendingSummary summary = overspendingSummarizer.summarize(analyzed);
        return new OverspendingAnalysis(analyzed, summary, schedule.frequency().value());
    }
}
