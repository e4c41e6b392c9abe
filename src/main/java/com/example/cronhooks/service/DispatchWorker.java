package com.example.cronhooks.service;

import com.example.cronhooks.domain.AttemptStatus;
import com.example.cronhooks.domain.DispatchTask;
import com.example.cronhooks.domain.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Queue consumer: claim a due task → run the executor on the pool → write DONE/FAILED back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchWorker {

    private final DispatchTxService tx;
    private final JobExecutor executor;
    private final ThreadPoolTaskExecutor dispatchExec;
    private final Clock clock;

    @Value("${cronhooks.queue.stale-after-seconds:600}")
    private long staleAfterSeconds;

    @Value("${cronhooks.queue.retention-days:7}")
    private long retentionDays;

    /**
     * Claims one due task and hands it to the pool. Returns false when nothing was due.
     */
    public boolean pollAndRunOnce() {
        Optional<DispatchTask> opt = tx.claimOneTx(owner());
        if (!opt.isPresent()) return false;

        DispatchTask task = opt.get();
        final Long taskId = task.getId();
        final Long jobId = task.getJobId();
        final int attempt = task.getAttemptNumber();
        final String ticket = task.getTicketNo();

        log.debug("Submit dispatch to pool: task={}, job={}, attempt={}", taskId, jobId, attempt);
        dispatchExec.execute(() -> executeAndComplete(taskId, jobId, attempt, ticket));
        return true;
    }

    void executeAndComplete(Long taskId, Long jobId, int attempt, String ticket) {
        TaskStatus finalStatus = TaskStatus.DONE;
        String message;
        try {
            Optional<AttemptStatus> st = executor.execute(jobId, attempt, ticket);
            message = st.isPresent() ? "attempt " + attempt + " " + st.get() : "skipped";
        } catch (Exception e) {
            log.error("Dispatch failed: task={}, job={}, ticket={}", taskId, jobId, ticket, e);
            finalStatus = TaskStatus.FAILED;
            message = e.toString();
        }
        try {
            tx.completeTx(taskId, finalStatus, message);
        } catch (RuntimeException e) {
            // 回写失败时任务保持 RUNNING，心跳过期后会被重新投递
            log.error("Failed to complete dispatch task {} as {}", taskId, finalStatus, e);
        }
    }

    public int requeueStale() {
        Instant threshold = clock.instant().minusSeconds(staleAfterSeconds);
        int n = tx.requeueStaleTx(threshold);
        if (n > 0) {
            log.warn("Requeued {} dispatch task(s) stuck in RUNNING since before {}", n, threshold);
        }
        return n;
    }

    public int purgeFinished() {
        Instant threshold = clock.instant().minus(Duration.ofDays(retentionDays));
        int n = tx.purgeFinishedTx(threshold);
        if (n > 0) {
            log.info("Purged {} finished dispatch task(s) older than {}", n, threshold);
        }
        return n;
    }

    private static String owner() {
        // pid@host
        String jvm = ManagementFactory.getRuntimeMXBean().getName();
        if (jvm == null || jvm.isEmpty()) return "local#na";
        return jvm.length() > 64 ? jvm.substring(0, 64) : jvm;
    }
}
