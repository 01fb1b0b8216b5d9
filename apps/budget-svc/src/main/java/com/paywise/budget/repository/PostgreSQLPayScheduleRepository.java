package com.paywise.budget.repository;

import com.paywise.budget.entity.PaySettingsEntity;
import com.paywise.budget.model.PayFrequency;
import com.paywise.budget.model.PaySchedule;
import java.time.Instant;
import java.util.Optional;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class PostgreSQLPayScheduleRepository implements PayScheduleRepository {

    private final JpaPaySettingsRepository jpaPaySettingsRepository;

    public PostgreSQLPayScheduleRepository(JpaPaySettingsRepository jpaPaySettingsRepository) {
        this.jpaPaySettingsRepository = jpaPaySettingsRepository;
    }

    @Override
    public Optional<PaySchedule> findCurrent() {
        return jpaPaySettingsRepository.findFirstByOrderByIdDesc()
                .map(this::toModel);
    }

    @Override
    @Transactional
    public PaySchedule save(PaySchedule schedule) {
        jpaPaySettingsRepository.deleteAllInBatch();
        PaySettingsEntity saved = jpaPaySettingsRepository.save(new PaySettingsEntity(
                schedule.lastPayDate(),
                schedule.frequency().value(),
                Instant.now()
        ));
        return toModel(saved);
    }

    private PaySchedule toModel(PaySettingsEntity entity) {
        return new PaySchedule(entity.getLastPayDate(), PayFrequency.fromValue(entity.getFrequency()));
    }
}
