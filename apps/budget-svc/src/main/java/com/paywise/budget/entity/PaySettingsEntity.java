package com.paywise.budget.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "pay_settings")
public class PaySettingsEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "last_pay_date", nullable = false)
    private LocalDate lastPayDate;

    // 'weekly' or 'biweekly'
    @Column(name = "frequency", nullable = false, length = 16)
    private String frequency;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    // Default constructor for JPA
    public PaySettingsEntity() {}

    public PaySettingsEntity(LocalDate lastPayDate, String frequency, Instant createdAt) {
        this.lastPayDate = lastPayDate;
        this.frequency = frequency;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public LocalDate getLastPayDate() { return lastPayDate; }
    public void setLastPayDate(LocalDate lastPayDate) { this.lastPayDate = lastPayDate; }

    public String getFrequency() { return frequency; }
    public void setFrequency(String frequency) { this.frequency = frequency; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
