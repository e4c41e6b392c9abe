package com.example.cronhooks.repo;

import java.time.Instant;
import java.util.Optional;

/**
 * Claims due dispatch tasks. One implementation per database dialect, selected by Spring profile.
 */
public interface TaskPicker {
    Optional<Long> lockOnePendingId(Instant now);

    int markRunning(Long id, String owner, Instant now);
}
