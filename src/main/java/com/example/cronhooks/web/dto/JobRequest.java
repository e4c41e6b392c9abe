package com.example.cronhooks.web.dto;

import com.example.cronhooks.domain.ScheduleKind;
import com.example.cronhooks.domain.TargetMethod;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Size;
import java.util.Map;

/**
 * Create / update payload for a webhook job. On update, {@code scheduleKind} must match the stored job.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobRequest {

    @NotBlank(message = "name is required")
    @Size(max = 255)
    private String name;

    @Size(max = 64)
    private String tenantId;

    @NotNull(message = "scheduleKind is required")
    private ScheduleKind scheduleKind;

    /**
     * ONCE only. Wall-clock time such as {@code 2025-03-09T02:30:00}; an offset, if present, is ignored.
     */
    private String fireAt;

    /**
     * RECURRING only. Five fields: minute hour day-of-month month day-of-week.
     */
    @Size(max = 100)
    private String cronExpression;

    @Size(max = 64)
    private String timezone;

    private TargetMethod httpMethod;

    @NotBlank(message = "url is required")
    @Size(max = 2048)
    private String url;

    private Map<String, String> headers;

    private JsonNode body;

    private Boolean active;

    @Min(0)
    @Max(20)
    private Integer maxRetries;

    @Min(0)
    @Max(86400)
    private Integer retryBaseDelaySeconds;

    @Min(1)
    @Max(300)
    private Integer timeoutSeconds;
}
