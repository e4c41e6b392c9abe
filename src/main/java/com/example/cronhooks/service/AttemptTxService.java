package com.example.cronhooks.service;

import com.example.cronhooks.domain.AttemptStatus;
import com.example.cronhooks.domain.ExecutionAttempt;
import com.example.cronhooks.domain.WebhookJob;
import com.example.cronhooks.repo.ExecutionAttemptRepo;
import com.example.cronhooks.repo.WebhookJobRepo;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * The two short transactions around an outbound call. The HTTP request itself runs between them with no
 * transaction and no lock held.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttemptTxService {

    private final WebhookJobRepo jobRepo;
    private final ExecutionAttemptRepo attemptRepo;
    private final DispatchGateway gateway;
    private final Clock clock;

    /**
     * Job snapshot plus the PENDING attempt row for this delivery. {@code recovered} marks a row left PENDING
     * by an earlier delivery of the same ticket whose worker never recorded the outcome.
     */
    @Getter
    public static class Started {
        private final WebhookJob job;
        private final Long attemptId;
        private final int attemptNumber;
        private final String ticket;
        private final boolean recovered;

        public Started(WebhookJob job, Long attemptId, int attemptNumber, String ticket) {
            this(job, attemptId, attemptNumber, ticket, false);
        }

        public Started(WebhookJob job, Long attemptId, int attemptNumber, String ticket, boolean recovered) {
            this.job = job;
            this.attemptId = attemptId;
            this.attemptNumber = attemptNumber;
            this.ticket = ticket;
            this.recovered = recovered;
        }
    }

    /**
     * 检查 + 建 PENDING 记录，在 job 行锁下完成；返回 empty 表示这次投递应直接丢弃。
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<Started> beginAttempt(Long jobId, int attemptNumber, String ticket) {
        Optional<WebhookJob> opt = jobRepo.findByIdForUpdate(jobId);
        if (!opt.isPresent()) {
            log.warn("Skip dispatch: job {} not found (ticket={})", jobId, ticket);
            return Optional.empty();
        }
        WebhookJob job = opt.get();

        // 同一 ticket 已有记录：仍是 PENDING 说明上次投递的 worker 中途丢失，交给 recordOutcome 收尾
        Optional<ExecutionAttempt> prior = attemptRepo.findByDispatchTicket(ticket);
        if (prior.isPresent()) {
            ExecutionAttempt p = prior.get();
            if (p.getStatus() == AttemptStatus.PENDING) {
                log.warn("Recovering attempt {} of job {}: ticket {} redelivered before its outcome was recorded",
                        p.getId(), jobId, ticket);
                return Optional.of(new Started(job, p.getId(), p.getAttemptNumber(), ticket, true));
            }
            log.info("Skip dispatch: ticket {} already produced an attempt for job {}", ticket, jobId);
            return Optional.empty();
        }

        if (!job.isActive()) {
            log.info("Skip dispatch: job {} is inactive (ticket={})", jobId, ticket);
            return Optional.empty();
        }

        if (job.isOnce()) {
            if (!ticket.equals(job.getDispatchHandle())) {
                log.info("Skip dispatch: stale ticket {} for once job {} (current={})", ticket, jobId, job.getDispatchHandle());
                return Optional.empty();
            }
            if (attemptNumber == 1 && attemptRepo.existsByJobIdAndStatus(jobId, AttemptStatus.SUCCESS)) {
                log.error("Prevented re-execution of once job {} that already succeeded; deactivating", jobId);
                jobRepo.updateActive(jobId, false);
                return Optional.empty();
            }
        }

        if (attemptNumber > 1 && attemptNumber > job.getMaxRetries()) {
            log.info("Skip dispatch: attempt {} exceeds maxRetries={} for job {}", attemptNumber, job.getMaxRetries(), jobId);
            return Optional.empty();
        }

        // 并发的重复投递会撞上 dispatch_ticket 唯一键
        ExecutionAttempt a = new ExecutionAttempt();
        a.setJobId(jobId);
        a.setDispatchTicket(ticket);
        a.setAttemptNumber(attemptNumber);
        a.setStatus(AttemptStatus.PENDING);
        a.setExecutedAt(clock.instant());
        attemptRepo.saveAndFlush(a);

        return Optional.of(new Started(job, a.getId(), attemptNumber, ticket));
    }

    /**
     * Writes the final status of the attempt and applies the job-level consequence: deactivate a finished
     * ONCE job, or enqueue the next retry. Empty if the attempt row was already finalized or removed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<AttemptStatus> recordOutcome(Started s, CallOutcome outcome) {
        WebhookJob job = s.getJob();
        Long jobId = job.getId();
        int attempt = s.getAttemptNumber();
        Instant now = clock.instant();

        // 重新加锁读 active 和 handle，调用期间可能被取消或被手动触发替换
        Optional<WebhookJob> locked = jobRepo.findByIdForUpdate(jobId);
        boolean stillActive = locked.map(WebhookJob::isActive).orElse(false);
        boolean current = !job.isOnce()
                || locked.map(j -> s.getTicket().equals(j.getDispatchHandle())).orElse(false);

        AttemptStatus status;
        if (outcome.isSuccess()) {
            status = AttemptStatus.SUCCESS;
        } else if (attempt < job.getMaxRetries() && stillActive && current) {
            status = AttemptStatus.RETRYING;
        } else {
            status = AttemptStatus.FAILED;
        }

        int updated = attemptRepo.recordOutcome(
                s.getAttemptId(),
                status,
                outcome.getResponseCode(),
                truncate(outcome.getResponseBody(), ExecutionAttempt.MAX_RESPONSE_BODY),
                truncate(outcome.getErrorMessage(), ExecutionAttempt.MAX_ERROR_MESSAGE),
                outcome.getFailureKind(),
                outcome.getDurationMillis());
        if (updated == 0) {
            log.warn("Attempt {} of job {} was already finalized, ignoring outcome {}", s.getAttemptId(), jobId, outcome);
            return Optional.empty();
        }
        jobRepo.updateLastExecutionAt(jobId, now);

        switch (status) {
            case SUCCESS:
                log.info("Job {} attempt {} succeeded: {}", jobId, attempt, outcome.getResponseCode());
                if (job.isOnce()) {
                    jobRepo.updateActive(jobId, false);
                    log.info("Deactivated once job {} after successful execution", jobId);
                }
                break;
            case RETRYING:
                long delay = RetryBackoff.delaySeconds(job.getRetryBaseDelaySeconds(), attempt);
                String retryTicket = gateway.enqueueAfter(jobId, attempt + 1, delay);
                if (job.isOnce()) {
                    jobRepo.updateDispatchHandle(jobId, retryTicket);
                }
                log.info("Job {} attempt {} failed ({}), retrying in {}s", jobId, attempt, describe(outcome), delay);
                break;
            default:
                log.warn("Job {} attempt {} failed ({}), no retries left", jobId, attempt, describe(outcome));
                if (job.isOnce() && current) {
                    jobRepo.updateActive(jobId, false);
                    log.warn("Deactivated once job {} after all retries exhausted", jobId);
                }
                break;
        }
        return Optional.of(status);
    }


    private static String describe(CallOutcome o) {
        return o.getFailureKind() + (o.getResponseCode() != null ? " " + o.getResponseCode() : "");
    }

    static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() > max ? s.substring(0, max) : s;
    }
}
