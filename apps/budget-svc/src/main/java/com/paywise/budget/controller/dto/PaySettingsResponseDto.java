package com.paywise.budget.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDate;

// both fields are null (rendered as {}) when no schedule is configured
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaySettingsResponseDto(LocalDate lastPayDate, String frequency) {

    public static PaySettingsResponseDto empty() {
        return new PaySettingsResponseDto(null, null);
    }
}
