package com.paywise.budget.controller;

import com.paywise.budget.analysis.InvalidAnalysisArgumentException;
import com.paywise.budget.analysis.OverspendingAnalysisService;
import com.paywise.budget.config.PaywiseProperties;
import com.paywise.budget.controller.dto.OverspendingAnalysisResponseDto;
import com.paywise.budget.model.OverspendingAnalysis;
import com.paywise.budget.model.Transaction;
import com.paywise.budget.web.RequestContextHolder;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/overspending-analysis")
public class OverspendingAnalysisController {

    private final OverspendingAnalysisService overspendingAnalysisService;
    private final PaywiseProperties properties;

    public OverspendingAnalysisController(OverspendingAnalysisService overspendingAnalysisService, PaywiseProperties properties) {
        this.overspendingAnalysisService = overspendingAnalysisService;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<OverspendingAnalysisResponseDto> analyze(
            @RequestParam(value = "periods", required = false) Integer periods,
            @RequestParam(value = "asOf", required = false) String asOf
    ) {
        var analysisConfig = properties.analysis();
        int requested = periods == null ? analysisConfig.defaultPeriods() : periods;
        if (requested > analysisConfig.maxPeriods()) {
            throw new InvalidAnalysisArgumentException("periods must not exceed " + analysisConfig.maxPeriods());
        }
        OverspendingAnalysis analysis = asOf == null || asOf.isBlank()
                ? overspendingAnalysisService.runOverspendingAnalysis(requested)
                : overspendingAnalysisService.runOverspendingAnalysis(requested, LocalDate.parse(asOf));
        return ResponseEntity.ok(map(analysis));
    }

    private OverspendingAnalysisResponseDto map(OverspendingAnalysis analysis) {
        var summary = analysis.summary();
        return new OverspendingAnalysisResponseDto(
                analysis.periods().stream().map(this::mapPeriod).toList(),
                new OverspendingAnalysisResponseDto.Summary(
                        money(summary.totalOverspent()),
                        money(summary.averageOverspent()),
                        summary.periodsAnalyzed(),
                        summary.problematicCategories().stream()
                                .map(category -> new OverspendingAnalysisResponseDto.ProblematicCategory(
                                        category.categoryId(),
                                        category.name(),
                                        category.color(),
                                        money(category.totalOverspent()),
                                        category.occurrences(),
                                        money(category.averageOverspent())
                                ))
                                .toList()
                ),
                analysis.payFrequency(),
                RequestContextHolder.traceId().orElse(null)
        );
    }

    private OverspendingAnalysisResponseDto.Period mapPeriod(OverspendingAnalysis.OverspendingPeriod period) {
        return new OverspendingAnalysisResponseDto.Period(
                period.startDate(),
                period.endDate(),
                money(period.totalBudget()),
                money(period.totalSpent()),
                money(period.overspent()),
                period.categories().stream()
                        .map(category -> new OverspendingAnalysisResponseDto.CategoryOverspending(
                                category.categoryId(),
                                category.name(),
                                category.color(),
                                money(category.budgetAmount()),
                                money(category.spent()),
                                money(category.overspent()),
                                money(category.overspentPercentage()),
                                mapTransactions(category.matchingTransactions())
                        ))
                        .toList(),
                mapTransactions(period.biggestTransactions())
        );
    }

    private List<OverspendingAnalysisResponseDto.TransactionDto> mapTransactions(List<Transaction> transactions) {
        return transactions.stream()
                .map(tx -> new OverspendingAnalysisResponseDto.TransactionDto(
                        tx.id(),
                        tx.date(),
                        tx.name(),
                        money(tx.amount()),
                        tx.categoryId(),
                        tx.notes().orElse(null)
                ))
                .toList();
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
