package com.example.cronhooks.domain;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import javax.persistence.*;
import java.time.Instant;

/**
 * A queued fire event: "invoke job X as attempt N, not before T". The ticket is the handle callers keep for revocation.
 */
@Entity
@Getter @Setter @ToString
@Table(name = "dispatch_task", indexes = {
        @Index(name = "idx_task_pick", columnList = "status, not_before, id"),
        @Index(name = "idx_task_job", columnList = "job_id")})
public class DispatchTask {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ticket_no", unique = true, nullable = false, length = 96)
    private String ticketNo;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber = 1;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TaskStatus status = TaskStatus.PENDING;

    @Column(name = "not_before", nullable = false)
    private Instant notBefore;

    @Column(name = "owner", length = 64)
    private String owner;

    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "finish_at")
    private Instant finishAt;

    @Column(name = "message", length = 2000)
    private String message;

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
