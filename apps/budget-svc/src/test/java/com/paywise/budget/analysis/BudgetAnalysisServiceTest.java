package com.paywise.budget.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.paywise.budget.model.BudgetAnalysis;
import com.paywise.budget.model.BudgetCategory;
import com.paywise.budget.model.PayFrequency;
import com.paywise.budget.model.PayPeriod;
import com.paywise.budget.model.PaySchedule;
import com.paywise.budget.model.Transaction;
import com.paywise.budget.repository.BudgetCategoryRepository;
import com.paywise.budget.repository.PayScheduleRepository;
import com.paywise.budget.repository.TransactionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;

class BudgetAnalysisServiceTest {

    @Mock
    private PayScheduleRepository payScheduleRepository;

    @Mock
    private BudgetCategoryRepository budgetCategoryRepository;

    @Mock
    private TransactionRepository transactionRepository;

    private BudgetAnalysisService service;

    private final LocalDate periodStart = LocalDate.parse("2025-01-31");
    private final LocalDate periodEnd = LocalDate.parse("2025-02-13");

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(Instant.parse("2025-02-01T09:30:00Z"), ZoneOffset.UTC);
        service = new BudgetAnalysisService(
                payScheduleRepository,
                budgetCategoryRepository,
                transactionRepository,
                new PayPeriodCalculator(),
                new CategorySpendAggregator(),
                clock
        );
    }

    @Test
    void comparesBudgetWithSpendForThePeriodContainingAsOf() {
        stubSchedule();
        when(budgetCategoryRepository.findActive()).thenReturn(List.of(
                new BudgetCategory(2L, "Dining", "#F97316", new BigDecimal("150"), true),
                new BudgetCategory(1L, "Groceries", "#22C55E", new BigDecimal("300"), true),
                new BudgetCategory(3L, "Gifts", "#A855F7", new BigDecimal("60"), true)
        ));
        when(transactionRepository.findByDateRange(periodStart, periodEnd)).thenReturn(List.of(
                transaction(10L, "2025-02-10", 2L, "-90"),
                transaction(11L, "2025-02-05", 1L, "20"),
                transaction(12L, "2025-01-31", 1L, "-100"),
                transaction(13L, "2025-02-02", null, "-40")
        ));

        BudgetAnalysis analysis = service.runBudgetAnalysis(LocalDate.parse("2025-02-01"));

        assertThat(analysis.period()).isEqualTo(new PayPeriod(periodStart, periodEnd));
        assertThat(analysis.payFrequency()).isEqualTo("biweekly");
        assertThat(analysis.categories()).extracting(BudgetAnalysis.CategoryBudget::name)
                .containsExactly("Dining", "Groceries", "Gifts");

        BudgetAnalysis.CategoryBudget dining = analysis.categories().get(0);
        assertThat(dining.allocated()).isEqualByComparingTo("70");
        assertThat(dining.spent()).isEqualByComparingTo("90");
        assertThat(dining.remaining()).isEqualByComparingTo("-20");

        BudgetAnalysis.CategoryBudget groceries = analysis.categories().get(1);
        assertThat(groceries.monthlyAllocation()).isEqualByComparingTo("300");
        assertThat(groceries.allocated()).isEqualByComparingTo("140");
        assertThat(groceries.spent()).isEqualByComparingTo("120");
        assertThat(groceries.remaining()).isEqualByComparingTo("20");
        assertThat(groceries.transactionCount()).isEqualTo(2);

        // under-budget categories without spend are still listed
        BudgetAnalysis.CategoryBudget gifts = analysis.categories().get(2);
        assertThat(gifts.spent()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(gifts.remaining()).isEqualByComparingTo("28");

        assertThat(analysis.totals().totalMonthlyAllocated()).isEqualByComparingTo("510");
        assertThat(analysis.totals().totalAllocated()).isEqualByComparingTo("238");
        assertThat(analysis.totals().totalSpent()).isEqualByComparingTo("210");
        assertThat(analysis.totals().totalRemaining()).isEqualByComparingTo("28");
    }

    @Test
    void defaultsToTodayFromClock() {
        stubSchedule();
        when(budgetCategoryRepository.findActive()).thenReturn(List.of());
        when(transactionRepository.findByDateRange(any(), any())).thenReturn(List.of());

        BudgetAnalysis analysis = service.runBudgetAnalysis();

        assertThat(analysis.period()).isEqualTo(new PayPeriod(periodStart, periodEnd));
        assertThat(analysis.totals().totalRemaining()).isEqualByComparingTo(BigDecimal.ZERO);
        verify(transactionRepository).findByDateRange(periodStart, periodEnd);
    }

    @Test
    void missingScheduleStopsBeforeLoadingBudgets() {
        when(payScheduleRepository.findCurrent()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.runBudgetAnalysis(LocalDate.parse("2025-02-01")))
                .isInstanceOf(MissingPayScheduleException.class);
        verifyNoInteractions(budgetCategoryRepository, transactionRepository);
    }

    @Test
    void storageFailureNamesTheFailedQuery() {
        stubSchedule();
        when(budgetCategoryRepository.findActive()).thenReturn(List.of());
        when(transactionRepository.findByDateRange(periodStart, periodEnd))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThatThrownBy(() -> service.runBudgetAnalysis(LocalDate.parse("2025-02-01")))
                .isInstanceOf(AnalysisDataAccessException.class)
                .satisfies(ex -> assertThat(((AnalysisDataAccessException) ex).getQuery())
                        .isEqualTo("transactions 2025-01-31..2025-02-13"))
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
    }

    private void stubSchedule() {
        when(payScheduleRepository.findCurrent())
                .thenReturn(Optional.of(new PaySchedule(LocalDate.parse("2025-01-03"), PayFrequency.BIWEEKLY)));
    }

    private Transaction transaction(Long id, String date, Long categoryId, String amount) {
        return new Transaction(id, LocalDate.parse(date), categoryId, new BigDecimal(amount), "tx-" + id, Optional.empty());
    }
}
