package com.paywise.budget.repository;

import com.paywise.budget.model.PaySchedule;
import java.util.Optional;

public interface PayScheduleRepository {

    Optional<PaySchedule> findCurrent();

    /**
     * Stores {@code schedule} as the only configured schedule, replacing any previous one.
     */
    PaySchedule save(PaySchedule schedule);
}
