package com.paywise.budget.service;

import com.paywise.budget.model.BudgetCategory;
import com.paywise.budget.repository.BudgetCategoryRepository;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BudgetCategoryService {

    private final BudgetCategoryRepository budgetCategoryRepository;

    public BudgetCategoryService(BudgetCategoryRepository budgetCategoryRepository) {
        this.budgetCategoryRepository = budgetCategoryRepository;
    }

    @Transactional(readOnly = true)
    public CategoryListResult listCategories(boolean onlyActive) {
        List<BudgetCategory> active = budgetCategoryRepository.findActive();
        List<BudgetCategory> categories = onlyActive ? active : budgetCategoryRepository.findAll();
        BigDecimal totalAllocated = active.stream()
                .map(BudgetCategory::allocatedAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new CategoryListResult(categories, totalAllocated);
    }

    public record CategoryListResult(List<BudgetCategory> categories, BigDecimal totalAllocated) {
    }
}
