package com.paywise.budget.repository;

import com.paywise.budget.model.BudgetCategory;
import java.util.List;

public interface BudgetCategoryRepository {

    List<BudgetCategory> findAll();

    List<BudgetCategory> findActive();
}
