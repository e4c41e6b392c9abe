package com.example.cronhooks.domain;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import javax.persistence.*;
import java.time.Instant;

/**
 * One recorded try at invoking a job's target. Rows are append-only history: each one is written
 * PENDING and then updated exactly once to its final status.
 */
@Entity
@Getter @Setter @ToString
@Table(name = "execution_attempt",
        uniqueConstraints = @UniqueConstraint(name = "uk_attempt_ticket", columnNames = "dispatch_ticket"),
        indexes = {
                @Index(name = "idx_attempt_job_time", columnList = "job_id, executed_at"),
                @Index(name = "idx_attempt_status", columnList = "status")})
public class ExecutionAttempt {
    public static final int MAX_RESPONSE_BODY = 10_000;
    public static final int MAX_ERROR_MESSAGE = 1_000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private Long jobId;

    @Column(name = "dispatch_ticket", nullable = false, length = 96, updatable = false)
    private String dispatchTicket;

    @Column(name = "attempt_number", nullable = false, updatable = false)
    private int attemptNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AttemptStatus status = AttemptStatus.PENDING;

    @Column(name = "response_code")
    private Integer responseCode;

    @Lob
    @Column(name = "response_body")
    @ToString.Exclude
    private String responseBody;

    @Column(name = "error_message", length = MAX_ERROR_MESSAGE)
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind", length = 32)
    private FailureKind failureKind;

    @Column(name = "duration_millis")
    private Long durationMillis;

    @Column(name = "executed_at", nullable = false, updatable = false)
    private Instant executedAt;

    @PrePersist
    public void prePersist() {
        if (executedAt == null) executedAt = Instant.now();
    }
}
