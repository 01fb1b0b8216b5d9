package com.paywise.budget.repository;

import com.paywise.budget.entity.PaySettingsEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaPaySettingsRepository extends JpaRepository<PaySettingsEntity, Long> {

    Optional<PaySettingsEntity> findFirstByOrderByIdDesc();
}
