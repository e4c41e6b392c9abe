package com.example.cronhooks.web.dto;

import com.example.cronhooks.domain.AttemptStatus;
import com.example.cronhooks.domain.ScheduleKind;
import com.example.cronhooks.domain.TargetMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobView {
    private Long id;
    private String tenantId;
    private String name;
    private ScheduleKind scheduleKind;
    private LocalDateTime fireAt;
    private String cronExpression;
    private String timezone;
    private TargetMethod httpMethod;
    private String url;
    private Map<String, String> headers;
    private String body;
    private boolean active;
    private int maxRetries;
    private int retryBaseDelaySeconds;
    private int timeoutSeconds;
    private Instant lastExecutionAt;
    private Instant createdAt;
    private Instant updatedAt;
    private long executionCount;
    private AttemptStatus lastExecutionStatus;
}
