package com.paywise.budget.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record PaySettingsRequestDto(
        @NotBlank(message = "Last pay date is required") String lastPayDate,
        @NotBlank @Pattern(regexp = "weekly|biweekly", message = "Frequency must be either \"weekly\" or \"biweekly\"") String frequency
) {
}
