package com.paywise.budget.analysis;

import com.paywise.budget.model.OverspendingAnalysis;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class OverspendingSummarizer {

    static final int PROBLEMATIC_CATEGORIES_LIMIT = 5;

    public OverspendingAnalysis.OverspendingSummary summarize(List<OverspendingAnalysis.OverspendingPeriod> periods) {
        if (periods == null || periods.isEmpty()) {
            throw new EmptyAnalysisInputException("Cannot summarize overspending over zero periods");
        }
        BigDecimal totalOverspent = periods.stream()
                .map(OverspendingAnalysis.OverspendingPeriod::overspent)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal averageOverspent = totalOverspent.divide(BigDecimal.valueOf(periods.size()), MathContext.DECIMAL128);

        // only categories listed in a period count as an occurrence
        Map<Long, CategoryTally> tallies = new LinkedHashMap<>();
        for (OverspendingAnalysis.OverspendingPeriod period : periods) {
            for (OverspendingAnalysis.CategoryOverspending category : period.categories()) {
                tallies.computeIfAbsent(category.categoryId(), id -> new CategoryTally(category.name(), category.color()))
                        .add(category.overspent());
            }
        }

        List<OverspendingAnalysis.ProblematicCategory> problematic = tallies.entrySet().stream()
                .map(entry -> entry.getValue().toProblematicCategory(entry.getKey()))
                .sorted(Comparator.comparing(OverspendingAnalysis.ProblematicCategory::totalOverspent).reversed()
                        .thenComparing(OverspendingAnalysis.ProblematicCategory::categoryId))
                .limit(PROBLEMATIC_CATEGORIES_LIMIT)
                .toList();

        return new OverspendingAnalysis.OverspendingSummary(totalOverspent, averageOverspent, periods.size(), problematic);
    }

    private static final class CategoryTally {
        private final String name;
        private final String color;
        private BigDecimal totalOverspent = BigDecimal.ZERO;
        private int occurrences;

        private CategoryTally(String name, String color) {
            this.name = name;
            this.color = color;
        }

        void add(BigDecimal overspent) {
            totalOverspent = totalOverspent.add(overspent);
            occurrences++;
        }

        OverspendingAnalysis.ProblematicCategory toProblematicCategory(Long categoryId) {
            return new OverspendingAnalysis.ProblematicCategory(
                    categoryId,
                    name,
                    color,
                    totalOverspent,
                    occurrences,
                    totalOverspent.divide(BigDecimal.valueOf(occurrences), MathContext.DECIMAL128)
            );
        }
    }
}
