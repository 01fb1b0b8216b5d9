package com.paywise.budget;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.paywise.budget.entity.BudgetCategoryEntity;
import com.paywise.budget.entity.TransactionEntity;
import com.paywise.budget.repository.JpaBudgetCategoryRepository;
import com.paywise.budget.repository.JpaPaySettingsRepository;
import com.paywise.budget.repository.JpaTransactionRepository;
import com.paywise.budget.web.TraceIdFilter;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class OverspendingAnalysisIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    JpaPaySettingsRepository jpaPaySettingsRepository;

    @Autowired
    JpaBudgetCategoryRepository jpaBudgetCategoryRepository;

    @Autowired
    JpaTransactionRepository jpaTransactionRepository;

    private Long diningId;
    private Long groceriesId;

    @BeforeEach
    void seed() {
        jpaTransactionRepository.deleteAll();
        jpaBudgetCategoryRepository.deleteAll();
        jpaPaySettingsRepository.deleteAll();

        Instant now = Instant.now();
        diningId = jpaBudgetCategoryRepository.save(new BudgetCategoryEntity("Dining", new BigDecimal("300.00"), "#ff0000", true, now)).getId();
        groceriesId = jpaBudgetCategoryRepository.save(new BudgetCategoryEntity("Groceries", new BigDecimal("150.00"), "#00ff00", true, now)).getId();
        Long travelId = jpaBudgetCategoryRepository.save(new BudgetCategoryEntity("Travel", new BigDecimal("30.00"), "#0000ff", false, now)).getId();

        // first period: 2025-01-03 .. 2025-01-16
        transaction("2025-01-05", diningId, "Steakhouse", "-100.00");
        transaction("2025-01-12", diningId, "Sushi", "-50.00");
        transaction("2025-01-10", groceriesId, "Market", "-20.00");
        transaction("2025-01-11", travelId, "Train", "-400.00");
        // second period: 2025-01-17 .. 2025-01-30
        transaction("2025-01-20", diningId, "Bistro", "-100.00");
        transaction("2025-01-22", groceriesId, "Market", "-185.00");
        transaction("2025-01-25", null, "Rent", "-500.00");
        // in progress on 2025-02-01, excluded
        transaction("2025-01-31", diningId, "Late dinner", "-999.00");
    }

    @Test
    void analyzesCompletedPeriodsEndToEnd() throws Exception {
        mockMvc.perform(post("/pay-settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lastPayDate\":\"2025-01-03\",\"frequency\":\"biweekly\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/overspending-analysis")
                        .param("periods", "2")
                        .param("asOf", "2025-02-01")
                        .header(TraceIdFilter.TRACE_HEADER, "trace-123"))
                .andExpect(status().isOk())
                .andExpect(header().string(TraceIdFilter.TRACE_HEADER, "trace-123"))
                .andExpect(jsonPath("$.traceId").value("trace-123"))
                .andExpect(jsonPath("$.payFrequency").value("biweekly"))
                .andExpect(jsonPath("$.periods.length()").value(2))
                .andExpect(jsonPath("$.periods[0].startDate").value("2025-01-03"))
                .andExpect(jsonPath("$.periods[0].endDate").value("2025-01-16"))
                .andExpect(jsonPath("$.periods[0].totalBudget").value(210.00))
                .andExpect(jsonPath("$.periods[0].totalSpent").value(170.00))
                .andExpect(jsonPath("$.periods[0].overspent").value(0.00))
                .andExpect(jsonPath("$.periods[0].categories.length()").value(1))
                .andExpect(jsonPath("$.periods[0].categories[0].name").value("Dining"))
                .andExpect(jsonPath("$.periods[0].categories[0].overspent").value(10.00))
                .andExpect(jsonPath("$.periods[0].categories[0].overspentPercentage").value(7.14))
                .andExpect(jsonPath("$.periods[0].categories[0].transactions.length()").value(2))
                .andExpect(jsonPath("$.periods[1].startDate").value("2025-01-17"))
                .andExpect(jsonPath("$.periods[1].endDate").value("2025-01-30"))
                .andExpect(jsonPath("$.periods[1].categories[0].name").value("Groceries"))
                .andExpect(jsonPath("$.periods[1].categories[0].overspentPercentage").value(164.29))
                .andExpect(jsonPath("$.periods[1].totalSpent").value(285.00))
                .andExpect(jsonPath("$.periods[1].overspent").value(75.00))
                .andExpect(jsonPath("$.periods[1].biggestTransactions[0].name").value("Rent"))
                .andExpect(jsonPath("$.periods[1].biggestTransactions[0].amount").value(500.00))
                .andExpect(jsonPath("$.summary.periodsAnalyzed").value(2))
                .andExpect(jsonPath("$.summary.totalOverspent").value(75.00))
                .andExpect(jsonPath("$.summary.averageOverspent").value(37.50))
                .andExpect(jsonPath("$.summary.problematicCategories[0].id").value(groceriesId))
                .andExpect(jsonPath("$.summary.problematicCategories[0].occurrences").value(1))
                .andExpect(jsonPath("$.summary.problematicCategories[1].id").value(diningId));
    }

    @Test
    void comparesBudgetWithSpendInTheCurrentPeriod() throws Exception {
        mockMvc.perform(post("/pay-settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"lastPayDate\":\"2025-01-03\",\"frequency\":\"biweekly\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/budget-analysis").param("asOf", "2025-02-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.startDate").value("2025-01-31"))
                .andExpect(jsonPath("$.summary.endDate").value("2025-02-13"))
                .andExpect(jsonPath("$.categories.length()").value(2))
                .andExpect(jsonPath("$.categories[0].name").value("Dining"))
                .andExpect(jsonPath("$.categories[0].spent").value(999.00))
                .andExpect(jsonPath("$.categories[0].remaining").value(-859.00))
                .andExpect(jsonPath("$.categories[1].name").value("Groceries"))
                .andExpect(jsonPath("$.categories[1].remaining").value(70.00))
                .andExpect(jsonPath("$.summary.totalAllocated").value(210.00))
                .andExpect(jsonPath("$.summary.totalSpent").value(999.00))
                .andExpect(jsonPath("$.summary.totalRemaining").value(-789.00));
    }

    @Test
    void reportsMissingPaySettings() throws Exception {
        mockMvc.perform(get("/overspending-analysis").param("asOf", "2025-02-01"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("PAY_SETTINGS_NOT_CONFIGURED"));
    }

    private void transaction(String date, Long categoryId, String name, String amount) {
        jpaTransactionRepository.save(new TransactionEntity(
                LocalDate.parse(date), categoryId, name, new BigDecimal(amount), null, Instant.now()));
    }
}
