package com.example.cronhooks.domain;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import javax.persistence.*;
import java.time.Instant;

/**
 * A cron cadence + timezone shared by every job that declares the same tuple.
 */
@Entity
@Getter @Setter @ToString
@Table(name = "periodic_trigger",
        uniqueConstraints = @UniqueConstraint(name = "uk_trigger_cadence",
                columnNames = {"cron_minute", "cron_hour", "cron_day_of_month", "cron_month", "cron_day_of_week", "tz_name"}),
        indexes = {@Index(name = "idx_trigger_enabled", columnList = "enabled")})
public class PeriodicTrigger {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cron_minute", length = 64, nullable = false)
    private String minute;

    @Column(name = "cron_hour", length = 64, nullable = false)
    private String hour;

    @Column(name = "cron_day_of_month", length = 64, nullable = false)
    private String dayOfMonth;

    @Column(name = "cron_month", length = 64, nullable = false)
    private String month;

    @Column(name = "cron_day_of_week", length = 64, nullable = false)
    private String dayOfWeek;

    @Column(name = "tz_name", length = 64, nullable = false)
    private String timezone;

    @Column(name = "enabled", nullable = false)
    private boolean enabled = true;

    @Column(name = "created_at")
    private Instant createdAt;

    public CronFields toCronFields() {
        return new CronFields(minute, hour, dayOfMonth, month, dayOfWeek);
    }
}
