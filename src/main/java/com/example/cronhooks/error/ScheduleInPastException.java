package com.example.cronhooks.error;

import java.time.Instant;

public class ScheduleInPastException extends CronhooksException {

    private final Instant resolvedFireAt;

    public ScheduleInPastException(Long jobId, Instant resolvedFireAt) {
        super("Scheduled time must be in the future: job=" + jobId + ", fireAt(UTC)=" + resolvedFireAt);
        this.resolvedFireAt = resolvedFireAt;
    }

    public Instant getResolvedFireAt() {
        return resolvedFireAt;
    }
}
