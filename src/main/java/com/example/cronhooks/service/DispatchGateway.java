package com.example.cronhooks.service;

import com.example.cronhooks.domain.CronFields;
import com.example.cronhooks.domain.PeriodicTrigger;

import java.time.Instant;

/**
 * Everything the engine needs from the task queue. Enqueue operations return a ticket, the handle later
 * passed to {@link #revoke(String)}; periodic bindings are addressed by their id.
 */
public interface DispatchGateway {

    /**
     * First attempt of a job, delivered no earlier than {@code fireAt}.
     */
    String enqueueAt(Long jobId, Instant fireAt);

    String enqueueNow(Long jobId, int attemptNumber);

    String enqueueAfter(Long jobId, int attemptNumber, long delaySeconds);

    /**
     * Best effort. Returns false if the ticket is unknown or already picked up.
     */
    boolean revoke(String ticket);

    PeriodicTrigger registerOrReusePeriodic(CronFields fields, String timezone);

    /**
     * Creates or re-points the job's binding. Returns the binding id.
     */
    Long bindPeriodic(Long jobId, Long triggerId, boolean enabled);

    boolean setPeriodicEnabled(Long handle, boolean enabled);
}
