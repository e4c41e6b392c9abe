package com.example.cronhooks.service;

import com.example.cronhooks.domain.CronFields;
import com.example.cronhooks.domain.PeriodicDispatch;
import com.example.cronhooks.domain.PeriodicTrigger;
import com.example.cronhooks.domain.TaskStatus;
import com.example.cronhooks.error.CronhooksException;
import com.example.cronhooks.repo.DispatchTaskRepo;
import com.example.cronhooks.repo.PeriodicDispatchRepo;
import com.example.cronhooks.repo.PeriodicTriggerRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns due cron times into dispatch tasks. Each enabled binding fires at most once per scan, for the latest
 * cron time in (cursor, now]; earlier missed times are coalesced into it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PeriodicFireService {
    private final PeriodicDispatchRepo dispatchRepo;
    private final PeriodicTriggerRepo triggerRepo;
    private final DispatchTaskRepo taskRepo;
    private final Clock clock;

    // 先在最近一天内找；稀疏的 cron 才从游标一路往后走
    private static final long RECENT_WINDOW_SECONDS = 86_400L;
    private static final int MAX_STEPS = 10_000;

    // trigger 行的 (cron, timezone) 建好后不变，按 id 缓存解析结果
    private final Map<Long, CronFields> cronCache = new ConcurrentHashMap<>();

    @Scheduled(fixedDelayString = "${cronhooks.periodic.scan-delay-ms:10000}", initialDelayString = "${cronhooks.periodic.initial-delay-ms:5000}")
    @Transactional
    public void fireDue() {
        Instant now = clock.instant();

        List<PeriodicDispatch> bindings = dispatchRepo.findByEnabledTrue();
        if (bindings.isEmpty()) return;

        Set<Long> triggerIds = bindings.stream().map(PeriodicDispatch::getTriggerId).collect(Collectors.toSet());
        Map<Long, PeriodicTrigger> triggers = triggerRepo.findAllById(triggerIds).stream()
                .collect(Collectors.toMap(PeriodicTrigger::getId, Function.identity()));

        for (PeriodicDispatch d : bindings) {
            PeriodicTrigger t = triggers.get(d.getTriggerId());
            if (t == null || !t.isEnabled()) continue;

            if (d.getLastFireAt() == null) {
                dispatchRepo.advanceLastFireAt(d.getId(), now);
                continue;
            }

            ZonedDateTime due;
            try {
                CronFields cron = cronCache.computeIfAbsent(t.getId(), id -> t.toCronFields());
                due = latestDue(cron, FireTimeResolver.zoneOf(t.getTimezone()), d.getLastFireAt(), now);
            } catch (CronhooksException e) {
                log.warn("Invalid periodic trigger id={}, tz={}: {}", t.getId(), t.getTimezone(), e.getMessage());
                continue;
            }
            if (due == null) continue;

            Instant at = due.toInstant();
            String ticket = "periodic#" + d.getId() + "#" + at.getEpochSecond();
            int inserted = taskRepo.insertIfNotExists(
                    ticket,                         // 1: ticket_no
                    d.getJobId(),                   // 2: job_id
                    1,                              // 3: attempt_number
                    TaskStatus.PENDING.name(),      // 4: status
                    Timestamp.from(at),             // 5: not_before
                    Timestamp.from(now)             // 6: created_at / updated_at
            );
            dispatchRepo.advanceLastFireAt(d.getId(), at);
            if (inserted > 0) {
                log.info("Fired periodic binding id={}, job={}, trigger={}, at={}", d.getId(), d.getJobId(), t.getId(), due);
            }
        }
    }

    /**
     * Latest cron time in (after, now], or null if there is none.
     */
    static ZonedDateTime latestDue(CronFields cron, ZoneId zone, Instant after, Instant now) {
        if (!after.isBefore(now)) return null;

        ZonedDateTime end = now.atZone(zone);
        Instant recentStart = now.minusSeconds(RECENT_WINDOW_SECONDS);
        if (after.isBefore(recentStart)) {
            ZonedDateTime recent = scan(cron, zone, recentStart, end);
            if (recent != null) return recent;
        }
        return scan(cron, zone, after, end);
    }

    private static ZonedDateTime scan(CronFields cron, ZoneId zone, Instant from, ZonedDateTime end) {
        ZonedDateTime last = null;
        ZonedDateTime next = cron.next(from.atZone(zone), zone);
        int steps = 0;
        while (next != null && !next.isAfter(end) && steps++ < MAX_STEPS) {
            last = next;
            next = cron.next(next, zone);
        }
        return last;
    }
}
