package com.example.cronhooks.domain;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.DynamicUpdate;

import javax.persistence.*;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A scheduled webhook. ONCE jobs carry {@code fireAt}, RECURRING jobs carry {@code cronExpression};
 * the other field stays null. {@code scheduleKind} never changes after creation.
 */
@Entity
@DynamicUpdate
@Getter @Setter @ToString
@Table(name = "webhook_job", indexes = {
        @Index(name = "idx_job_tenant_active", columnList = "tenant_id, active"),
        @Index(name = "idx_job_kind", columnList = "schedule_kind")})
public class WebhookJob {
    public static final String DEFAULT_TIMEZONE = "UTC";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", length = 64)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_kind", nullable = false, length = 16, updatable = false)
    private ScheduleKind scheduleKind;

    // ONCE: 用户填写的本地墙钟时间，按 tzName 解释
    @Column(name = "fire_at")
    private LocalDateTime fireAt;

    @Column(name = "cron_expression", length = 100)
    private String cronExpression;

    @Column(name = "tz_name", nullable = false, length = 64)
    private String timezone = DEFAULT_TIMEZONE;

    @Enumerated(EnumType.STRING)
    @Column(name = "http_method", nullable = false, length = 8)
    private TargetMethod httpMethod = TargetMethod.POST;

    @Column(nullable = false, length = 2048)
    private String url;

    @Convert(converter = HeadersConverter.class)
    @Column(name = "headers", length = 4000)
    @ToString.Exclude
    private Map<String, String> headers = new LinkedHashMap<>();

    @Lob
    @Column(name = "body")
    @ToString.Exclude
    private String body;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries = 3;

    @Column(name = "retry_base_delay_seconds", nullable = false)
    private int retryBaseDelaySeconds = 60;

    @Column(name = "timeout_seconds", nullable = false)
    private int timeoutSeconds = 30;

    // ONCE: 当前有效的投递 ticket（撤销用）
    @Column(name = "dispatch_handle", length = 96)
    private String dispatchHandle;

    // RECURRING: 共享的 cron 触发器 + 本 job 自己的绑定
    @Column(name = "periodic_trigger_id")
    private Long periodicTriggerId;

    @Column(name = "periodic_handle")
    private Long periodicHandle;

    // 当前这一代排期的生成时刻；幂等检查只看这之后的 SUCCESS
    @Column(name = "planned_at")
    private Instant plannedAt;

    @Column(name = "last_execution_at")
    private Instant lastExecutionAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isOnce() {
        return scheduleKind == ScheduleKind.ONCE;
    }

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }
}
