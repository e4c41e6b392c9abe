package com.example.cronhooks.service;

import com.example.cronhooks.domain.CronFields;
import com.example.cronhooks.domain.PeriodicDispatch;
import com.example.cronhooks.domain.PeriodicTrigger;
import com.example.cronhooks.repo.DispatchTaskRepo;
import com.example.cronhooks.repo.PeriodicDispatchRepo;
import com.example.cronhooks.repo.PeriodicTriggerRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PeriodicFireServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T10:05:10Z");

    @Mock
    private PeriodicDispatchRepo dispatchRepo;

    @Mock
    private PeriodicTriggerRepo triggerRepo;

    @Mock
    private DispatchTaskRepo taskRepo;

    private PeriodicFireService fireService;

    @BeforeEach
    void setUp() {
        fireService = new PeriodicFireService(dispatchRepo, triggerRepo, taskRepo, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static PeriodicTrigger trigger(Long id, String cron, String tz, boolean enabled) {
        CronFields f = CronFields.parse(cron);
        PeriodicTrigger t = new PeriodicTrigger();
        t.setId(id);
        t.setMinute(f.getMinute());
        t.setHour(f.getHour());
        t.setDayOfMonth(f.getDayOfMonth());
        t.setMonth(f.getMonth());
        t.setDayOfWeek(f.getDayOfWeek());
        t.setTimezone(tz);
        t.setEnabled(enabled);
        return t;
    }

    private static PeriodicDispatch binding(Long id, Long jobId, Long triggerId, Instant cursor) {
        PeriodicDispatch d = new PeriodicDispatch();
        d.setId(id);
        d.setJobId(jobId);
        d.setTriggerId(triggerId);
        d.setEnabled(true);
        d.setLastFireAt(cursor);
        return d;
    }

    @Test
    void latestDue_MissedFires_CoalesceToLatest() {
        ZonedDateTime due = PeriodicFireService.latestDue(CronFields.parse("* * * * *"), ZoneOffset.UTC,
                Instant.parse("2025-01-01T10:00:30Z"), NOW);

        assertEquals(Instant.parse("2025-01-01T10:05:00Z"), due.toInstant());
    }

    @Test
    void latestDue_NothingDue_Null() {
        assertNull(PeriodicFireService.latestDue(CronFields.parse("0 * * * *"), ZoneOffset.UTC,
                Instant.parse("2025-01-01T10:00:00Z"), NOW));
    }

    @Test
    void latestDue_CursorAtNow_Null() {
        assertNull(PeriodicFireService.latestDue(CronFields.parse("* * * * *"), ZoneOffset.UTC, NOW, NOW));
    }

    @Test
    void latestDue_OldCursor_SparseCron() {
        // yearly on Jan 1st 00:00, cursor two years back
        ZonedDateTime due = PeriodicFireService.latestDue(CronFields.parse("0 0 1 1 *"), ZoneOffset.UTC,
                Instant.parse("2023-06-01T00:00:00Z"), NOW);

        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), due.toInstant());
    }

    @Test
    void latestDue_EvaluatedInTriggerZone() {
        // 05:00 in New York (EST) is 10:00Z
        ZonedDateTime due = PeriodicFireService.latestDue(CronFields.parse("0 5 * * *"), ZoneId.of("America/New_York"),
                Instant.parse("2025-01-01T09:00:00Z"), NOW);

        assertEquals(Instant.parse("2025-01-01T10:00:00Z"), due.toInstant());
    }

    @Test
    void fireDue_DueBinding_EnqueuesDeduplicatedTicketAndAdvancesCursor() {
        when(dispatchRepo.findByEnabledTrue()).thenReturn(Collections.singletonList(
                binding(5L, 50L, 1L, Instant.parse("2025-01-01T10:00:30Z"))));
        when(triggerRepo.findAllById(any())).thenReturn(Collections.singletonList(trigger(1L, "* * * * *", "UTC", true)));
        Instant due = Instant.parse("2025-01-01T10:05:00Z");
        when(taskRepo.insertIfNotExists(eq("periodic#5#" + due.getEpochSecond()), eq(50L), eq(1), eq("PENDING"),
                eq(Timestamp.from(due)), any(Timestamp.class))).thenReturn(1);

        fireService.fireDue();

        verify(dispatchRepo).advanceLastFireAt(5L, due);
    }

    @Test
    void fireDue_AlreadyFiredByOtherInstance_StillAdvancesCursor() {
        when(dispatchRepo.findByEnabledTrue()).thenReturn(Collections.singletonList(
                binding(5L, 50L, 1L, Instant.parse("2025-01-01T10:04:30Z"))));
        when(triggerRepo.findAllById(any())).thenReturn(Collections.singletonList(trigger(1L, "* * * * *", "UTC", true)));
        when(taskRepo.insertIfNotExists(anyString(), anyLong(), anyInt(), anyString(), any(Timestamp.class), any(Timestamp.class)))
                .thenReturn(0);

        fireService.fireDue();

        verify(dispatchRepo).advanceLastFireAt(5L, Instant.parse("2025-01-01T10:05:00Z"));
    }

    @Test
    void fireDue_DisabledTrigger_Skipped() {
        when(dispatchRepo.findByEnabledTrue()).thenReturn(Collections.singletonList(
                binding(5L, 50L, 1L, Instant.parse("2025-01-01T10:00:30Z"))));
        when(triggerRepo.findAllById(any())).thenReturn(Collections.singletonList(trigger(1L, "* * * * *", "UTC", false)));

        fireService.fireDue();

        verifyNoInteractions(taskRepo);
        verify(dispatchRepo, never()).advanceLastFireAt(anyLong(), any());
    }

    @Test
    void fireDue_NoCursor_StartsNowWithoutBackfill() {
        when(dispatchRepo.findByEnabledTrue()).thenReturn(Collections.singletonList(binding(5L, 50L, 1L, null)));
        when(triggerRepo.findAllById(any())).thenReturn(Collections.singletonList(trigger(1L, "* * * * *", "UTC", true)));

        fireService.fireDue();

        verify(dispatchRepo).advanceLastFireAt(5L, NOW);
        verifyNoInteractions(taskRepo);
    }

    @Test
    void fireDue_NoBindings_NoQueries() {
        when(dispatchRepo.findByEnabledTrue()).thenReturn(Collections.emptyList());

        fireService.fireDue();

        verifyNoInteractions(triggerRepo, taskRepo);
    }

    @Test
    void fireDue_SharedTriggerAcrossScans_ParsedOnce() {
        PeriodicTrigger t = spy(trigger(1L, "* * * * *", "UTC", true));
        when(dispatchRepo.findByEnabledTrue()).thenReturn(Arrays.asList(
                binding(5L, 50L, 1L, Instant.parse("2025-01-01T10:00:30Z")),
                binding(6L, 60L, 1L, Instant.parse("2025-01-01T10:00:30Z"))));
        when(triggerRepo.findAllById(any())).thenReturn(Collections.singletonList(t));
        when(taskRepo.insertIfNotExists(anyString(), anyLong(), anyInt(), anyString(), any(Timestamp.class), any(Timestamp.class)))
                .thenReturn(1);

        fireService.fireDue();
        fireService.fireDue();

        verify(t, times(1)).toCronFields();
        verify(taskRepo, times(4)).insertIfNotExists(anyString(), anyLong(), anyInt(), anyString(), any(Timestamp.class), any(Timestamp.class));
    }
}
