package com.paywise.budget.analysis;

import com.paywise.budget.model.PayPeriod;
import com.paywise.budget.model.PaySchedule;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class PayPeriodCalculator {

    // pay dates sit on lastPayDate + k * frequency and each one opens a period
    static final int MAX_GRID_STEPS = 10_000;

    // oldest first
    public List<PayPeriod> recentCompletedPeriods(PaySchedule schedule, int count, LocalDate asOf) {
        if (schedule == null) {
            throw new MissingPayScheduleException();
        }
        if (count <= 0) {
            throw new InvalidAnalysisArgumentException("Number of periods must be positive, got " + count);
        }
        if (asOf == null) {
            throw new IllegalArgumentException("asOf date must be provided");
        }
        int length = schedule.frequency().days();
        LocalDate periodStart = latestCompletedStart(schedule, asOf);

        List<PayPeriod> periods = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            periods.add(0, new PayPeriod(periodStart, periodStart.plusDays(length - 1L)));
            periodStart = periodStart.minusDays(length);
        }
        return periods;
    }

    public PayPeriod currentPeriod(PaySchedule schedule, LocalDate asOf) {
        if (schedule == null) {
            throw new MissingPayScheduleException();
        }
        if (asOf == null) {
            throw new IllegalArgumentException("asOf date must be provided");
        }
        int length = schedule.frequency().days();
        LocalDate start = schedule.lastPayDate();
        int steps = 0;
        while (start.isAfter(asOf)) {
            start = start.minusDays(length);
            steps = checkSteps(steps, schedule, asOf);
        }
        while (!start.plusDays(length).isAfter(asOf)) {
            start = start.plusDays(length);
            steps = checkSteps(steps, schedule, asOf);
        }
        return new PayPeriod(start, start.plusDays(length - 1L));
    }

    private LocalDate latestCompletedStart(PaySchedule schedule, LocalDate asOf) {
        int length = schedule.frequency().days();
        LocalDate start = schedule.lastPayDate();
        int steps = 0;
        // step back while the candidate period has not finished yet
        while (start.plusDays(length - 1L).isAfter(asOf)) {
            start = start.minusDays(length);
            steps = checkSteps(steps, schedule, asOf);
        }
        // step forward while the following period has also finished
        while (!start.plusDays(2L * length - 1L).isAfter(asOf)) {
            start = start.plusDays(length);
            steps = checkSteps(steps, schedule, asOf);
        }
        return start;
    }

    private static int checkSteps(int steps, PaySchedule schedule, LocalDate asOf) {
        int next = steps + 1;
        if (next > MAX_GRID_STEPS) {
            throw new InvalidPayScheduleException("No completed pay period found within " + MAX_GRID_STEPS
                    + " " + schedule.frequency().value() + " steps of last pay date "
                    + schedule.lastPayDate() + " (as of " + asOf + ")");
        }
        return next;
    }
}
