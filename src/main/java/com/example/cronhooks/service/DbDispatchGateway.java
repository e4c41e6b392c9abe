package com.example.cronhooks.service;

import com.example.cronhooks.domain.CronFields;
import com.example.cronhooks.domain.PeriodicTrigger;
import com.example.cronhooks.domain.TaskStatus;
import com.example.cronhooks.repo.DispatchTaskRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Task queue kept in the {@code dispatch_task} table and drained by {@link DispatchWorker}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DbDispatchGateway implements DispatchGateway {

    // 库里 TIMESTAMP 能存的上限附近，超大退避时间截到这里
    static final Instant LATEST_NOT_BEFORE = Instant.parse("9999-12-31T00:00:00Z");

    private final DispatchTaskRepo taskRepo;
    private final PeriodicTriggerRegistry registry;
    private final Clock clock;

    @Override
    @Transactional
    public String enqueueAt(Long jobId, Instant fireAt) {
        return enqueue(jobId, 1, fireAt);
    }

    @Override
    @Transactional
    public String enqueueNow(Long jobId, int attemptNumber) {
        return enqueue(jobId, attemptNumber, clock.instant());
    }

    @Override
    @Transactional
    public String enqueueAfter(Long jobId, int attemptNumber, long delaySeconds) {
        Instant now = clock.instant();
        long maxDelay = LATEST_NOT_BEFORE.getEpochSecond() - now.getEpochSecond();
        Instant at = delaySeconds >= maxDelay ? LATEST_NOT_BEFORE : now.plusSeconds(Math.max(0L, delaySeconds));
        return enqueue(jobId, attemptNumber, at);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean revoke(String ticket) {
        if (ticket == null) return false;
        int n = taskRepo.revokePending(ticket, clock.instant());
        if (n > 0) {
            log.info("Dispatch revoked: ticket={}", ticket);
        } else {
            log.debug("Nothing to revoke for ticket={} (unknown or already picked up)", ticket);
        }
        return n > 0;
    }

    /**
     * Not transactional here: the registry commits on its own, so a unique-key race can be retried by re-reading.
     */
    @Override
    public PeriodicTrigger registerOrReusePeriodic(CronFields fields, String timezone) {
        try {
            return registry.registerOrReuse(fields, timezone);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent registration of cron='{}' tz={}, reusing the winner", fields, timezone);
            return registry.lookup(fields, timezone).orElseThrow(() -> e);
        }
    }

    @Override
    public Long bindPeriodic(Long jobId, Long triggerId, boolean enabled) {
        return registry.bind(jobId, triggerId, enabled);
    }

    @Override
    public boolean setPeriodicEnabled(Long handle, boolean enabled) {
        if (handle == null) return false;
        return registry.setEnabled(handle, enabled);
    }

    private String enqueue(Long jobId, int attemptNumber, Instant notBefore) {
        String ticket = newTicket(jobId, attemptNumber);
        taskRepo.insertIfNotExists(
                ticket,                             // 1: ticket_no
                jobId,                              // 2: job_id
                attemptNumber,                      // 3: attempt_number
                TaskStatus.PENDING.name(),          // 4: status
                Timestamp.from(notBefore),          // 5: not_before
                Timestamp.from(clock.instant())     // 6: created_at / updated_at
        );
        log.info("Dispatch enqueued: job={}, attempt={}, notBefore={}, ticket={}", jobId, attemptNumber, notBefore, ticket);
        return ticket;
    }

    static String newTicket(Long jobId, int attemptNumber) {
        return "job#" + jobId + "#a" + attemptNumber + "#" + UUID.randomUUID().toString().replace("-", "");
    }
}
