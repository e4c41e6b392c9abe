package com.example.cronhooks.service;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PollScheduler {
    private final DispatchWorker worker;

    @Value("${scheduler.poll.batch:16}")
    private int maxPerTick;

    @Scheduled(fixedDelayString = "${scheduler.poll.delay-ms:2000}", initialDelayString = "${scheduler.poll.initial-delay-ms:3000}")
    public void tick() {
        for (int i = 0; i < maxPerTick; i++) {
            if (!worker.pollAndRunOnce()) {
                break;
            }
        }
    }

    @Scheduled(fixedDelayString = "${cronhooks.queue.reap-delay-ms:60000}", initialDelayString = "${cronhooks.queue.reap-initial-delay-ms:30000}")
    public void reap() {
        worker.requeueStale();
    }

    @Scheduled(cron = "${cronhooks.queue.cleanup-cron:0 30 3 * * *}")
    public void cleanup() {
        worker.purgeFinished();
    }
}
