package com.paywise.budget.controller;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.paywise.budget.analysis.BudgetAnalysisService;
import com.paywise.budget.analysis.MissingPayScheduleException;
import com.paywise.budget.model.BudgetAnalysis;
import com.paywise.budget.model.PayPeriod;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(BudgetAnalysisController.class)
class BudgetAnalysisControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    BudgetAnalysisService budgetAnalysisService;

    @Test
    void rendersCategoriesAndRoundedTotals() throws Exception {
        when(budgetAnalysisService.runBudgetAnalysis(LocalDate.parse("2025-02-01"))).thenReturn(sampleAnalysis());

        mockMvc.perform(get("/budget-analysis").param("asOf", "2025-02-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories.length()").value(1))
                .andExpect(jsonPath("$.categories[0].name").value("Dining"))
                .andExpect(jsonPath("$.categories[0].fullMonthAmount").value(100.00))
                .andExpect(jsonPath("$.categories[0].allocatedAmount").value(46.67))
                .andExpect(jsonPath("$.categories[0].spent").value(50.00))
                .andExpect(jsonPath("$.categories[0].remaining").value(-3.33))
                .andExpect(jsonPath("$.categories[0].transactionCount").value(3))
                .andExpect(jsonPath("$.summary.startDate").value("2025-01-31"))
                .andExpect(jsonPath("$.summary.endDate").value("2025-02-13"))
                .andExpect(jsonPath("$.summary.daysInPeriod").value(14))
                .andExpect(jsonPath("$.summary.payFrequency").value("biweekly"))
                .andExpect(jsonPath("$.summary.totalAllocated").value(46.67))
                .andExpect(jsonPath("$.summary.totalRemaining").value(-3.33));
    }

    @Test
    void omittedAsOfUsesToday() throws Exception {
        when(budgetAnalysisService.runBudgetAnalysis()).thenReturn(sampleAnalysis());

        mockMvc.perform(get("/budget-analysis"))
                .andExpect(status().isOk());

        verify(budgetAnalysisService).runBudgetAnalysis();
    }

    @Test
    void malformedAsOfIsRejected() throws Exception {
        mockMvc.perform(get("/budget-analysis").param("asOf", "01/02/2025"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void missingScheduleIsASetupError() throws Exception {
        when(budgetAnalysisService.runBudgetAnalysis()).thenThrow(new MissingPayScheduleException());

        mockMvc.perform(get("/budget-analysis"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("PAY_SETTINGS_NOT_CONFIGURED"));
    }

    private BudgetAnalysis sampleAnalysis() {
        BigDecimal allocated = new BigDecimal("100").divide(BigDecimal.valueOf(30), MathContext.DECIMAL128)
                .multiply(BigDecimal.valueOf(14));
        BigDecimal spent = new BigDecimal("50");
        BigDecimal remaining = allocated.subtract(spent);
        return new BudgetAnalysis(
                new PayPeriod(LocalDate.parse("2025-01-31"), LocalDate.parse("2025-02-13")),
                "biweekly",
                List.of(new BudgetAnalysis.CategoryBudget(7L, "Dining", "#F97316", new BigDecimal("100"),
                        allocated, spent, remaining, 3)),
                new BudgetAnalysis.Totals(new BigDecimal("100"), allocated, spent, remaining)
        );
    }
}
