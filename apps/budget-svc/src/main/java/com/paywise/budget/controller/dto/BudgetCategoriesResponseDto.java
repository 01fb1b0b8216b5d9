package com.paywise.budget.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record BudgetCategoriesResponseDto(List<Category> categories, BigDecimal totalAllocated) {

    public record Category(Long id, String name, String color, BigDecimal allocatedAmount, boolean active) {
    }
}
