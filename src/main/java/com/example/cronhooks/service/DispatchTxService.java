package com.example.cronhooks.service;

import com.example.cronhooks.domain.DispatchTask;
import com.example.cronhooks.domain.TaskStatus;
import com.example.cronhooks.repo.DispatchTaskRepo;
import com.example.cronhooks.repo.TaskPicker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchTxService {

    private final DispatchTaskRepo taskRepo;
    private final TaskPicker picker;
    private final Clock clock;

    /**
     * 原子领取（新事务）：TaskPicker 加锁选一条 + 条件 UPDATE 置为 RUNNING
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<DispatchTask> claimOneTx(String owner) {
        Instant now = clock.instant();
        Optional<Long> idOpt = picker.lockOnePendingId(now);
        if (!idOpt.isPresent()) return Optional.empty();

        Long id = idOpt.get();
        int ok = picker.markRunning(id, owner, now);
        if (ok == 0) {
            // 被其它实例抢走
            return Optional.empty();
        }
        return taskRepo.findById(id);
    }

    /**
     * 完成回写（新事务），只改仍为 RUNNING 的行
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void completeTx(Long taskId, TaskStatus status, String message) {
        int n = taskRepo.complete(taskId, status, trimErr(message), clock.instant());
        if (n == 0) {
            log.warn("Dispatch task {} was no longer RUNNING when completing as {}", taskId, status);
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int requeueStaleTx(Instant threshold) {
        return taskRepo.requeueStale(threshold, clock.instant());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int purgeFinishedTx(Instant threshold) {
        return taskRepo.deleteFinishedBefore(threshold);
    }

    static String trimErr(String m) {
        if (m == null) return null;
        m = m.replaceAll("\\s+", " ").trim();
        return m.length() > 1900 ? m.substring(0, 1900) : m;
    }
}
