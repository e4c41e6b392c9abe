package com.example.cronhooks.service;

import com.example.cronhooks.domain.CronFields;
import com.example.cronhooks.domain.PeriodicTrigger;
import com.example.cronhooks.domain.WebhookJob;
import com.example.cronhooks.error.InvalidJobDefinitionException;
import com.example.cronhooks.error.ScheduleInPastException;
import com.example.cronhooks.repo.WebhookJobRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Turns a job definition into queue state: one future dispatch for ONCE jobs, a binding on a shared
 * periodic trigger for RECURRING jobs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulePlanner {

    private final DispatchGateway gateway;
    private final WebhookJobRepo jobRepo;
    private final Clock clock;

    @Transactional
    public void schedule(WebhookJob job) {
        if (job.isOnce()) {
            scheduleOnce(job);
        } else {
            scheduleRecurring(job);
        }
    }

    /**
     * Enqueues the first attempt at the job's resolved fire time and records the ticket as the job's handle.
     *
     * @throws ScheduleInPastException if that time is not strictly in the future
     */
    @Transactional
    public String scheduleOnce(WebhookJob job) {
        Instant now = clock.instant();
        Instant at = resolveOnce(job, now);

        String ticket = gateway.enqueueAt(job.getId(), at);
        jobRepo.updateOnceSchedule(job.getId(), ticket, now);
        job.setDispatchHandle(ticket);
        job.setPlannedAt(now);

        log.info("Scheduled once job={}, fireAt={} {}, utc={}, ticket={}",
                job.getId(), job.getFireAt(), job.getTimezone(), at, ticket);
        return ticket;
    }

    /**
     * Registers (or reuses) the trigger for the job's cadence and binds the job to it. The binding starts
     * enabled only if the job is active.
     */
    @Transactional
    public Long scheduleRecurring(WebhookJob job) {
        Instant now = clock.instant();
        CronFields fields = CronFields.parse(job.getCronExpression());
        FireTimeResolver.zoneOf(job.getTimezone());

        PeriodicTrigger trigger = gateway.registerOrReusePeriodic(fields, job.getTimezone());
        Long handle = gateway.bindPeriodic(job.getId(), trigger.getId(), job.isActive());
        jobRepo.updatePeriodicSchedule(job.getId(), trigger.getId(), handle, now);
        job.setPeriodicTriggerId(trigger.getId());
        job.setPeriodicHandle(handle);
        job.setPlannedAt(now);

        log.info("Scheduled recurring job={}, cron='{}', tz={}, trigger={}, binding={}",
                job.getId(), fields, job.getTimezone(), trigger.getId(), handle);
        return handle;
    }

    /**
     * Same checks as {@link #schedule(WebhookJob)} without touching the queue or the job row.
     */
    public void validate(WebhookJob job) {
        if (job.isOnce()) {
            resolveOnce(job, clock.instant());
        } else {
            CronFields.parse(job.getCronExpression());
            FireTimeResolver.zoneOf(job.getTimezone());
        }
    }

    private Instant resolveOnce(WebhookJob job, Instant now) {
        if (job.getFireAt() == null) {
            throw new InvalidJobDefinitionException("fireAt", "is required for ONCE jobs");
        }
        Instant at = FireTimeResolver.resolve(job.getFireAt(), job.getTimezone());
        if (!at.isAfter(now)) {
            throw new ScheduleInPastException(job.getId(), at);
        }
        return at;
    }
}
