package com.paywise.budget.service;

import com.paywise.budget.analysis.MissingPayScheduleException;
import com.paywise.budget.analysis.PayPeriodCalculator;
import com.paywise.budget.model.PayFrequency;
import com.paywise.budget.model.PayPeriod;
import com.paywise.budget.model.PaySchedule;
import com.paywise.budget.repository.PayScheduleRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PayScheduleService {

    private static final Logger log = LoggerFactory.getLogger(PayScheduleService.class);

    private final PayScheduleRepository payScheduleRepository;
    private final PayPeriodCalculator payPeriodCalculator;
    private final Clock clock;

    public PayScheduleService(PayScheduleRepository payScheduleRepository, PayPeriodCalculator payPeriodCalculator, Clock clock) {
        this.payScheduleRepository = payScheduleRepository;
        this.payPeriodCalculator = payPeriodCalculator;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public Optional<PaySchedule> findSchedule() {
        return payScheduleRepository.findCurrent();
    }

    @Transactional
    public PaySchedule saveSchedule(LocalDate lastPayDate, String frequency) {
        PaySchedule schedule = new PaySchedule(lastPayDate, PayFrequency.fromValue(frequency));
        PaySchedule saved = payScheduleRepository.save(schedule);
        log.info("Pay schedule updated: lastPayDate={}, frequency={}", saved.lastPayDate(), saved.frequency().value());
        return saved;
    }

    @Transactional(readOnly = true)
    public PayPeriod currentPeriod(Optional<LocalDate> asOf) {
        PaySchedule schedule = payScheduleRepository.findCurrent()
                .orElseThrow(MissingPayScheduleException::new);
        return payPeriodCalculator.currentPeriod(schedule, asOf.orElseGet(() -> LocalDate.now(clock)));
    }
}
