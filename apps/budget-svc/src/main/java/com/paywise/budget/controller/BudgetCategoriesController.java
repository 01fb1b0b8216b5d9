package com.paywise.budget.controller;

import com.paywise.budget.controller.dto.BudgetCategoriesResponseDto;
import com.paywise.budget.service.BudgetCategoryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/budget-categories")
public class BudgetCategoriesController {

    private final BudgetCategoryService budgetCategoryService;

    public BudgetCategoriesController(BudgetCategoryService budgetCategoryService) {
        this.budgetCategoryService = budgetCategoryService;
    }

    @GetMapping
    public ResponseEntity<BudgetCategoriesResponseDto> listCategories(
            @RequestParam(value = "active", required = false, defaultValue = "false") boolean onlyActive
    ) {
        var result = budgetCategoryService.listCategories(onlyActive);
        var response = new BudgetCategoriesResponseDto(
                result.categories().stream()
                        .map(category -> new BudgetCategoriesResponseDto.Category(
                                category.id(),
                                category.name(),
                                category.color(),
                                category.allocatedAmount(),
                                category.active()
                        ))
                        .toList(),
                result.totalAllocated()
        );
        return ResponseEntity.ok(response);
    }
}
