package com.example.cronhooks.domain;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import javax.persistence.*;
import java.time.Instant;

/**
 * One job's subscription to a {@link PeriodicTrigger}. Enabling/disabling a job touches only its own binding,
 * so jobs sharing a trigger never stop each other.
 */
@Entity
@Getter @Setter @ToString
@Table(name = "periodic_dispatch",
        uniqueConstraints = @UniqueConstraint(name = "uk_periodic_job", columnNames = "job_id"),
        indexes = {@Index(name = "idx_periodic_trigger", columnList = "trigger_id, enabled")})
public class PeriodicDispatch {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @Column(name = "trigger_id", nullable = false)
    private Long triggerId;

    @Column(name = "enabled", nullable = false)
    private boolean enabled = true;

    // 上次已投递的 cron 时刻（游标）
    @Column(name = "last_fire_at")
    private Instant lastFireAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    public void touch() {
        updatedAt = Instant.now();
    }
}
