package com.example.cronhooks.service;

import com.example.cronhooks.domain.WebhookJob;
import com.example.cronhooks.error.InvalidTimezoneException;
import org.springframework.util.StringUtils;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Wall-clock ↔ instant conversion for job schedules.
 */
public final class FireTimeResolver {

    private FireTimeResolver() {
    }

    /**
     * Blank means UTC. Unknown names raise {@link InvalidTimezoneException}.
     */
    public static ZoneId zoneOf(String timezone) {
        if (!StringUtils.hasText(timezone) || WebhookJob.DEFAULT_TIMEZONE.equals(timezone.trim())) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new InvalidTimezoneException(timezone, e);
        }
    }

    /**
     * Interprets {@code fireAt} as local time in {@code timezone}. A wall-clock time that falls in a DST gap
     * moves forward by the gap; one that falls in an overlap takes the earlier offset.
     */
    public static Instant resolve(LocalDateTime fireAt, String timezone) {
        return fireAt.atZone(zoneOf(timezone)).toInstant();
    }

    /**
     * Accepts {@code 2025-03-09T02:30:00} or the same with an offset / {@code Z}; any offset is discarded and
     * the wall-clock part is read in the job's own timezone.
     */
    public static LocalDateTime parseWallClock(String text) {
        return LocalDateTime.from(DateTimeFormatter.ISO_DATE_TIME.parse(text.trim()));
    }
}
