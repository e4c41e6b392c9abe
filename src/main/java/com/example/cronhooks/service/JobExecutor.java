package com.example.cronhooks.service;

import com.example.cronhooks.domain.AttemptStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Runs one fire event {@code (jobId, attemptNumber, ticket)}: guard checks and PENDING row, the outbound call,
 * then outcome and follow-up (deactivate or retry).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobExecutor {

    private final AttemptTxService tx;
    private final WebhookCaller caller;

    /**
     * Returns the recorded attempt status, or empty if the event was discarded without an attempt.
     */
    public Optional<AttemptStatus> execute(Long jobId, int attemptNumber, String ticket) {
        Optional<AttemptTxService.Started> started;
        try {
            started = tx.beginAttempt(jobId, attemptNumber, ticket);
        } catch (DataIntegrityViolationException e) {
            // 并发重复投递撞上 dispatch_ticket 唯一键
            log.info("Skip dispatch: ticket {} for job {} is already being executed", ticket, jobId);
            return Optional.empty();
        }
        if (!started.isPresent()) {
            return Optional.empty();
        }

        AttemptTxService.Started s = started.get();
        CallOutcome outcome;
        if (s.isRecovered()) {
            // 不重发：上一次调用可能已送达
            outcome = CallOutcome.workerLost();
        } else {
            log.info("Executing job {} ({} {}), attempt {}", jobId, s.getJob().getHttpMethod(), s.getJob().getUrl(), attemptNumber);
            outcome = caller.call(s.getJob());
        }

        try {
            return tx.recordOutcome(s, outcome);
        } catch (RuntimeException e) {
            log.error("Failed to record outcome of job {} attempt {} ({}), recording as transport error",
                    jobId, s.getAttemptNumber(), outcome, e);
            return tx.recordOutcome(s, CallOutcome.transportError(
                    "Outcome could not be recorded: " + e.getMessage(), outcome.getDurationMillis()));
        }
    }
}
