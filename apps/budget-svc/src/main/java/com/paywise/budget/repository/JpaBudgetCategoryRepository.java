package com.paywise.budget.repository;

import com.paywise.budget.entity.BudgetCategoryEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaBudgetCategoryRepository extends JpaRepository<BudgetCategoryEntity, Long> {

    @Query("SELECT c FROM BudgetCategoryEntity c ORDER BY c.name ASC")
    List<BudgetCategoryEntity> findAllOrderByName();

    @Query("SELECT c FROM BudgetCategoryEntity c WHERE c.active = true ORDER BY c.name ASC")
    List<BudgetCategoryEntity> findActiveOrderByName();
}
