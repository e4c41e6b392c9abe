package com.example.cronhooks.service;

import com.example.cronhooks.domain.AttemptStatus;
import com.example.cronhooks.domain.FailureKind;
import com.example.cronhooks.domain.ScheduleKind;
import com.example.cronhooks.domain.WebhookJob;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobExecutorTest {

    @Mock
    private AttemptTxService tx;

    @Mock
    private WebhookCaller caller;

    @InjectMocks
    private JobExecutor executor;

    @Test
    void execute_GuardRejects_NoCall() {
        when(tx.beginAttempt(1L, 1, "t1")).thenReturn(Optional.empty());

        assertFalse(executor.execute(1L, 1, "t1").isPresent());
        verifyNoInteractions(caller);
        verify(tx, never()).recordOutcome(any(), any());
    }

    @Test
    void execute_ConcurrentDuplicateTicket_NoCall() {
        when(tx.beginAttempt(1L, 1, "t1")).thenThrow(new DataIntegrityViolationException("uk_attempt_ticket"));

        assertFalse(executor.execute(1L, 1, "t1").isPresent());
        verifyNoInteractions(caller);
    }

    @Test
    void execute_Started_CallsAndRecords() {
        WebhookJob job = new WebhookJob();
        job.setId(1L);
        job.setScheduleKind(ScheduleKind.RECURRING);
        job.setUrl("http://localhost/hook");
        AttemptTxService.Started started = new AttemptTxService.Started(job, 10L, 1, "t1");
        CallOutcome outcome = CallOutcome.response(200, "ok", 4);

        when(tx.beginAttempt(1L, 1, "t1")).thenReturn(Optional.of(started));
        when(caller.call(job)).thenReturn(outcome);
        when(tx.recordOutcome(started, outcome)).thenReturn(Optional.of(AttemptStatus.SUCCESS));

        assertEquals(Optional.of(AttemptStatus.SUCCESS), executor.execute(1L, 1, "t1"));
        verify(caller).call(job);
    }

    @Test
    void execute_RecoveredAttempt_RecordsWorkerLostWithoutCalling() {
        WebhookJob job = new WebhookJob();
        job.setId(1L);
        job.setScheduleKind(ScheduleKind.ONCE);
        job.setUrl("http://localhost/hook");
        AttemptTxService.Started started = new AttemptTxService.Started(job, 10L, 1, "t1", true);

        when(tx.beginAttempt(1L, 1, "t1")).thenReturn(Optional.of(started));
        when(tx.recordOutcome(eq(started), any(CallOutcome.class))).thenReturn(Optional.of(AttemptStatus.RETRYING));

        assertEquals(Optional.of(AttemptStatus.RETRYING), executor.execute(1L, 1, "t1"));
        verifyNoInteractions(caller);

        ArgumentCaptor<CallOutcome> captor = ArgumentCaptor.forClass(CallOutcome.class);
        verify(tx).recordOutcome(eq(started), captor.capture());
        assertEquals(FailureKind.TRANSPORT_ERROR, captor.getValue().getFailureKind());
        assertEquals("Worker lost during call, outcome unknown", captor.getValue().getErrorMessage());
    }

    @Test
    void execute_RecordOutcomeThrows_RecordsAsTransportError() {
        WebhookJob job = new WebhookJob();
        job.setId(1L);
        job.setScheduleKind(ScheduleKind.ONCE);
        job.setUrl("http://localhost/hook");
        AttemptTxService.Started started = new AttemptTxService.Started(job, 10L, 1, "t1");
        CallOutcome outcome = CallOutcome.response(200, "ok", 4);

        when(tx.beginAttempt(1L, 1, "t1")).thenReturn(Optional.of(started));
        when(caller.call(job)).thenReturn(outcome);
        when(tx.recordOutcome(started, outcome)).thenThrow(new IllegalStateException("lock timeout"));
        when(tx.recordOutcome(eq(started), argThat(o -> o != outcome))).thenReturn(Optional.of(AttemptStatus.RETRYING));

        assertEquals(Optional.of(AttemptStatus.RETRYING), executor.execute(1L, 1, "t1"));

        ArgumentCaptor<CallOutcome> captor = ArgumentCaptor.forClass(CallOutcome.class);
        verify(tx, times(2)).recordOutcome(eq(started), captor.capture());
        CallOutcome fallback = captor.getAllValues().get(1);
        assertFalse(fallback.isSuccess());
        assertEquals(FailureKind.TRANSPORT_ERROR, fallback.getFailureKind());
        assertEquals("Outcome could not be recorded: lock timeout", fallback.getErrorMessage());
        assertEquals(4L, fallback.getDurationMillis());
    }
}
