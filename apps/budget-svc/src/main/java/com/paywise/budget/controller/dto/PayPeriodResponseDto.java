package com.paywise.budget.controller.dto;

import java.time.LocalDate;

public record PayPeriodResponseDto(LocalDate startDate, LocalDate endDate, int lengthInDays) {
}
