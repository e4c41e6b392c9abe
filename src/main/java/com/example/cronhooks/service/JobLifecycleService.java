package com.example.cronhooks.service;

import com.example.cronhooks.domain.WebhookJob;
import com.example.cronhooks.error.AlreadyActiveException;
import com.example.cronhooks.error.JobNotFoundException;
import com.example.cronhooks.repo.WebhookJobRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Cancel and reactivate. Queue-side cleanup on cancel is best effort; the executor's active check covers
 * anything that slips through.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLifecycleService {

    private final WebhookJobRepo jobRepo;
    private final DispatchGateway gateway;
    private final SchedulePlanner planner;

    @Transactional
    public WebhookJob cancel(Long jobId) {
        WebhookJob job = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

        if (job.isOnce()) {
            if (job.getDispatchHandle() != null) {
                try {
                    gateway.revoke(job.getDispatchHandle());
                } catch (RuntimeException e) {
                    log.warn("Failed to revoke dispatch {} for job {}: {}", job.getDispatchHandle(), jobId, e.toString());
                }
            }
        } else if (job.getPeriodicHandle() != null) {
            try {
                gateway.setPeriodicEnabled(job.getPeriodicHandle(), false);
            } catch (RuntimeException e) {
                log.warn("Failed to disable periodic binding {} for job {}: {}", job.getPeriodicHandle(), jobId, e.toString());
            }
        }

        jobRepo.updateActive(jobId, false);
        job.setActive(false);
        log.info("Canceled job {}", jobId);
        return job;
    }

    /**
     * @throws AlreadyActiveException if the job is active
     * @throws com.example.cronhooks.error.ScheduleInPastException for a ONCE job whose time has passed
     */
    @Transactional
    public WebhookJob reactivate(Long jobId) {
        WebhookJob job = jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.isActive()) {
            throw new AlreadyActiveException(jobId);
        }
        planner.validate(job);

        jobRepo.updateActive(jobId, true);
        job.setActive(true);
        planner.schedule(job);
        log.info("Reactivated job {}", jobId);
        return job;
    }
}
