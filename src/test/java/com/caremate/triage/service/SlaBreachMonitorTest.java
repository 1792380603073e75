package com.caremate.triage.service;

import com.caremate.triage.component.ResponsePhrases;
import com.caremate.triage.component.StaffAssignment;
import com.caremate.triage.entity.ApprovalQueueEntry;
import com.caremate.triage.triage.PatientContext;
import com.caremate.triage.triage.SlaBreachEvent;
import com.caremate.triage.utils.ApprovalStatus;
import com.caremate.triage.utils.UrgencyLevel;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SlaBreachMonitorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void sweepPublishesOneEventPerNewBreach() {
        ApprovalQueueService approvals = mock(ApprovalQueueService.class);
        ApplicationEventPublisher events = mock(ApplicationEventPublisher.class);
        ApprovalQueueEntry entry = ApprovalQueueEntry.builder()
                .id("APR-1").patientId("P001").status(ApprovalStatus.PENDING)
                .priority(UrgencyLevel.CRITICAL).slaMinutes(5).slaDeadline(NOW.minusSeconds(60)).build();
        when(approvals.markSlaBreaches(NOW)).thenReturn(List.of(entry)).thenReturn(List.of());
        SlaBreachMonitor monitor = new SlaBreachMonitor(approvals, events, clock);

        monitor.sweep();
        monitor.sweep();

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(events).publishEvent(captor.capture());
        SlaBreachEvent event = (SlaBreachEvent) captor.getValue();
        assertEquals("APR-1", event.getEntryId());
        assertEquals(UrgencyLevel.CRITICAL, event.getPriority());
        assertEquals(NOW, event.getBreachedAt());
    }

    @Test
    void failedSweepPublishesNothing() {
        ApprovalQueueService approvals = mock(ApprovalQueueService.class);
        ApplicationEventPublisher events = mock(ApplicationEventPublisher.class);
        when(approvals.markSlaBreaches(NOW)).thenThrow(new QueryTimeoutException("lock wait"));

        new SlaBreachMonitor(approvals, events, clock).sweep();

        verify(events, never()).publishEvent(any(Object.class));
    }

    @Test
    void breachIsEscalatedToAttendingPhysician() {
        PatientContextProvider patients = mock(PatientContextProvider.class);
        when(patients.lookup("P001")).thenReturn(Optional.of(
                new PatientContext("P001", "John Smith", "101A", List.of(), List.of(), List.of(), "N001", "D001")));
        NotificationDispatcher dispatcher = mock(NotificationDispatcher.class);
        when(dispatcher.dispatch(any(), any(), anyString(), anyString())).thenReturn(List.of());
        SlaBreachNotifier notifier = new SlaBreachNotifier(patients,
                new StaffAssignment("NURSE_ON_DUTY", "DR_ON_CALL", "RAPID_RESPONSE"), dispatcher, new ResponsePhrases());

        notifier.onBreach(new SlaBreachEvent("APR-1", "P001", UrgencyLevel.MEDIUM, 30, NOW));
        notifier.onBreach(new SlaBreachEvent("APR-2", "P001", UrgencyLevel.CRITICAL, 5, NOW));

        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(dispatcher).dispatch(eq(List.of("D001")), eq(UrgencyLevel.HIGH), eq("P001"), message.capture());
        assertTrue(message.getValue().contains("APR-1"));
        verify(dispatcher).dispatch(eq(List.of("D001")), eq(UrgencyLevel.CRITICAL), eq("P001"), anyString());
    }
}
