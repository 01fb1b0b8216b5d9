package com.paywise.budget.repository;

import com.paywise.budget.entity.BudgetCategoryEntity;
import com.paywise.budget.model.BudgetCategory;
import java.util.List;
import org.springframework.stereotype.Repository;

@Repository
public class PostgreSQLBudgetCategoryRepository implements BudgetCategoryRepository {

    private final JpaBudgetCategoryRepository jpaBudgetCategoryRepository;

    public PostgreSQLBudgetCategoryRepository(JpaBudgetCategoryRepository jpaBudgetCategoryRepository) {
        this.jpaBudgetCategoryRepository = jpaBudgetCategoryRepository;
    }

    @Override
    public List<BudgetCategory> findAll() {
        return jpaBudgetCategoryRepository.findAllOrderByName().stream()
                .map(this::toModel)
                .toList();
    }

    @Override
    public List<BudgetCategory> findActive() {
        return jpaBudgetCategoryRepository.findActiveOrderByName().stream()
                .map(this::toModel)
                .toList();
    }

    private BudgetCategory toModel(BudgetCategoryEntity entity) {
        return new BudgetCategory(
                entity.getId(),
                entity.getName(),
                entity.getColor(),
                entity.getAllocatedAmount(),
                entity.isActive()
        );
    }
}
