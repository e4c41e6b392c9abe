package com.example.cronhooks.service;

import com.example.cronhooks.domain.CronFields;
import com.example.cronhooks.domain.PeriodicTrigger;
import com.example.cronhooks.repo.DispatchTaskRepo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DbDispatchGatewayTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    private DispatchTaskRepo taskRepo;

    @Mock
    private PeriodicTriggerRegistry registry;

    private DbDispatchGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new DbDispatchGateway(taskRepo, registry, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void enqueueAfter_DelayAddedToNow() {
        String ticket = gateway.enqueueAfter(3L, 2, 120);

        ArgumentCaptor<Timestamp> notBefore = ArgumentCaptor.forClass(Timestamp.class);
        verify(taskRepo).insertIfNotExists(eq(ticket), eq(3L), eq(2), eq("PENDING"), notBefore.capture(), any(Timestamp.class));
        assertEquals(NOW.plusSeconds(120), notBefore.getValue().toInstant());
        assertTrue(ticket.startsWith("job#3#a2#"));
    }

    @Test
    void enqueueAfter_SaturatedDelay_Clamped() {
        gateway.enqueueAfter(3L, 2, Long.MAX_VALUE);

        ArgumentCaptor<Timestamp> notBefore = ArgumentCaptor.forClass(Timestamp.class);
        verify(taskRepo).insertIfNotExists(anyString(), anyLong(), anyInt(), anyString(), notBefore.capture(), any(Timestamp.class));
        assertEquals(DbDispatchGateway.LATEST_NOT_BEFORE, notBefore.getValue().toInstant());
    }

    @Test
    void enqueue_TicketsAreUnique() {
        assertNotEquals(gateway.enqueueNow(1L, 1), gateway.enqueueNow(1L, 1));
    }

    @Test
    void revoke_PendingTicket_True() {
        when(taskRepo.revokePending("t1", NOW)).thenReturn(1);

        assertTrue(gateway.revoke("t1"));
    }

    @Test
    void revoke_AlreadyPickedUp_False() {
        when(taskRepo.revokePending("t1", NOW)).thenReturn(0);

        assertFalse(gateway.revoke("t1"));
        assertFalse(gateway.revoke(null));
    }

    @Test
    void registerOrReusePeriodic_LostRace_ReadsWinner() {
        CronFields f = CronFields.parse("0 * * * *");
        PeriodicTrigger winner = new PeriodicTrigger();
        winner.setId(11L);
        when(registry.registerOrReuse(f, "UTC")).thenThrow(new DataIntegrityViolationException("uk_trigger_cadence"));
        when(registry.lookup(f, "UTC")).thenReturn(Optional.of(winner));

        assertSame(winner, gateway.registerOrReusePeriodic(f, "UTC"));
    }

    @Test
    void setPeriodicEnabled_NullHandle_False() {
        assertFalse(gateway.setPeriodicEnabled(null, false));
        verifyNoInteractions(registry);
    }
}
