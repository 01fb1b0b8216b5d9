package com.paywise.budget.controller;

import com.paywise.budget.controller.dto.PayPeriodResponseDto;
import com.paywise.budget.controller.dto.PaySettingsRequestDto;
import com.paywise.budget.controller.dto.PaySettingsResponseDto;
import com.paywise.budget.model.PayPeriod;
import com.paywise.budget.model.PaySchedule;
import com.paywise.budget.service.PayScheduleService;
import jakarta.validation.Valid;
import java.time.LocalDate;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PaySettingsController {

    private final PayScheduleService payScheduleService;

    public PaySettingsController(PayScheduleService payScheduleService) {
        this.payScheduleService = payScheduleService;
    }

    @GetMapping("/pay-settings")
    public ResponseEntity<PaySettingsResponseDto> getPaySettings() {
        PaySettingsResponseDto response = payScheduleService.findSchedule()
                .map(this::map)
                .orElseGet(PaySettingsResponseDto::empty);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/pay-settings")
    public ResponseEntity<PaySettingsResponseDto> savePaySettings(@RequestBody @Valid PaySettingsRequestDto request) {
        PaySchedule saved = payScheduleService.saveSchedule(LocalDate.parse(request.lastPayDate()), request.frequency());
        return ResponseEntity.ok(map(saved));
    }

    @GetMapping("/pay-periods/current")
    public ResponseEntity<PayPeriodResponseDto> currentPeriod(@RequestParam(value = "asOf", required = false) String asOf) {
        Optional<LocalDate> date = Optional.ofNullable(asOf).filter(value -> !value.isBlank()).map(LocalDate::parse);
        PayPeriod period = payScheduleService.currentPeriod(date);
        return ResponseEntity.ok(new PayPeriodResponseDto(period.startDate(), period.endDate(), period.lengthInDays()));
    }

    private PaySettingsResponseDto map(PaySchedule schedule) {
        return new PaySettingsResponseDto(schedule.lastPayDate(), schedule.frequency().value());
    }
}
