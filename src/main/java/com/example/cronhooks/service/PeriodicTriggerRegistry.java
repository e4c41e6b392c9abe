package com.example.cronhooks.service;

import com.example.cronhooks.domain.CronFields;
import com.example.cronhooks.domain.PeriodicDispatch;
import com.example.cronhooks.domain.PeriodicTrigger;
import com.example.cronhooks.repo.PeriodicDispatchRepo;
import com.example.cronhooks.repo.PeriodicTriggerRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Shared cron triggers and the per-job bindings on them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PeriodicTriggerRegistry {

    private final PeriodicTriggerRepo triggerRepo;
    private final PeriodicDispatchRepo dispatchRepo;
    private final Clock clock;

    /**
     * 独立短事务：并发创建同一 cadence 时，唯一键冲突只回滚这里，调用方重读即可。
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PeriodicTrigger registerOrReuse(CronFields f, String timezone) {
        Optional<PeriodicTrigger> existing = find(f, timezone);
        if (existing.isPresent()) {
            return existing.get();
        }
        int inserted = triggerRepo.insertIfNotExists(
                f.getMinute(),
                f.getHour(),
                f.getDayOfMonth(),
                f.getMonth(),
                f.getDayOfWeek(),
                timezone,
                true,
                Timestamp.from(clock.instant())
        );
        if (inserted > 0) {
            log.info("Periodic trigger registered: cron='{}', tz={}", f, timezone);
        }
        return find(f, timezone)
                .orElseThrow(() -> new IllegalStateException("Periodic trigger vanished after insert: " + f + " " + timezone));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<PeriodicTrigger> lookup(CronFields f, String timezone) {
        return find(f, timezone);
    }

    @Transactional
    public Long bind(Long jobId, Long triggerId, boolean enabled) {
        PeriodicDispatch binding = dispatchRepo.findByJobId(jobId).orElseGet(PeriodicDispatch::new);
        Long previousTrigger = binding.getTriggerId();

        binding.setJobId(jobId);
        binding.setTriggerId(triggerId);
        binding.setEnabled(enabled);
        // 游标从现在开始，不补发绑定之前的时刻
        binding.setLastFireAt(clock.instant());
        dispatchRepo.saveAndFlush(binding);

        refreshTrigger(triggerId);
        if (previousTrigger != null && !previousTrigger.equals(triggerId)) {
            refreshTrigger(previousTrigger);
        }
        log.info("Job {} bound to periodic trigger {} (binding={}, enabled={})", jobId, triggerId, binding.getId(), enabled);
        return binding.getId();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean setEnabled(Long handle, boolean enabled) {
        Optional<PeriodicDispatch> opt = dispatchRepo.findById(handle);
        if (!opt.isPresent()) {
            log.warn("Periodic binding not found: {}", handle);
            return false;
        }
        PeriodicDispatch binding = opt.get();
        if (enabled && !binding.isEnabled()) {
            binding.setLastFireAt(clock.instant());
        }
        binding.setEnabled(enabled);
        dispatchRepo.saveAndFlush(binding);
        refreshTrigger(binding.getTriggerId());
        return true;
    }

    /**
     * A trigger stays enabled while any job bound to it is.
     */
    private void refreshTrigger(Long triggerId) {
        boolean anyEnabled = dispatchRepo.countByTriggerIdAndEnabledTrue(triggerId) > 0;
        triggerRepo.updateEnabled(triggerId, anyEnabled);
    }

    private Optional<PeriodicTrigger> find(CronFields f, String timezone) {
        return triggerRepo.findByMinuteAndHourAndDayOfMonthAndMonthAndDayOfWeekAndTimezone(
                f.getMinute(), f.getHour(), f.getDayOfMonth(), f.getMonth(), f.getDayOfWeek(), timezone);
    }
}
