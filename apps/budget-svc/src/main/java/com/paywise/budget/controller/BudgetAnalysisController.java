package com.paywise.budget.controller;

import com.paywise.budget.analysis.BudgetAnalysisService;
import com.paywise.budget.controller.dto.BudgetAnalysisResponseDto;
import com.paywise.budget.model.BudgetAnalysis;
import com.paywise.budget.web.RequestContextHolder;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/budget-analysis")
public class BudgetAnalysisController {

    private final BudgetAnalysisService budgetAnalysisService;

    public BudgetAnalysisController(BudgetAnalysisService budgetAnalysisService) {
        this.budgetAnalysisService = budgetAnalysisService;
    }

    @GetMapping
    public ResponseEntity<BudgetAnalysisResponseDto> analyze(@RequestParam(value = "asOf", required = false) String asOf) {
        BudgetAnalysis analysis = asOf == null || asOf.isBlank()
                ? budgetAnalysisService.runBudgetAnalysis()
                : budgetAnalysisService.runBudgetAnalysis(LocalDate.parse(asOf));
        var totals = analysis.totals();
        var response = new BudgetAnalysisResponseDto(
                analysis.categories().stream()
                        .map(category -> new BudgetAnalysisResponseDto.Category(
                                category.categoryId(),
                                category.name(),
                                category.color(),
                                money(category.monthlyAllocation()),
                                money(category.allocated()),
                                money(category.spent()),
                                money(category.remaining()),
                                category.transactionCount()
                        ))
                        .toList(),
                new BudgetAnalysisResponseDto.Summary(
                        analysis.period().startDate(),
                        analysis.period().endDate(),
                        analysis.period().lengthInDays(),
                        analysis.payFrequency(),
                        money(totals.totalMonthlyAllocated()),
                        money(totals.totalAllocated()),
                        money(totals.totalSpent()),
                        money(totals.totalRemaining())
                ),
                RequestContextHolder.traceId().orElse(null)
        );
        return ResponseEntity.ok(response);
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
