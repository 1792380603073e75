package com.caremate.triage.service;

import com.caremate.triage.entity.NotificationOutcome;
import com.caremate.triage.repository.NotificationOutcomeRepository;
import com.caremate.triage.triage.NotificationRecord;
import com.caremate.triage.utils.DeliveryStatus;
import com.caremate.triage.utils.NotificationChannelType;
import com.caremate.triage.utils.UrgencyLevel;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotificationOutcomeServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:05:00Z");

    @Test
    void finalOutcomeIsStoredAgainstItsAuditEntry() {
        NotificationOutcomeRepository repository = mock(NotificationOutcomeRepository.class);
        when(repository.save(any(NotificationOutcome.class))).thenAnswer(inv -> inv.getArgument(0));
        NotificationOutcomeService service = new NotificationOutcomeService(repository, Clock.fixed(NOW, ZoneOffset.UTC));
        NotificationRecord failed = NotificationRecord.failed("D001",
                EnumSet.of(NotificationChannelType.DASHBOARD, NotificationChannelType.PUSH),
                UrgencyLevel.HIGH, Instant.parse("2026-03-02T10:04:59Z"), 3, "DASHBOARD: socket closed");

        service.recordFinal("REQ-1", "LOG-1", failed);

        ArgumentCaptor<NotificationOutcome> captor = ArgumentCaptor.forClass(NotificationOutcome.class);
        verify(repository).save(captor.capture());
        NotificationOutcome outcome = captor.getValue();
        assertEquals(failed.getId(), outcome.getNotificationId());
        assertEquals("REQ-1", outcome.getRequestId());
        assertEquals("LOG-1", outcome.getAuditId());
        assertEquals("D001", outcome.getRecipientId());
        assertEquals("DASHBOARD,PUSH", outcome.getChannels());
        assertEquals(DeliveryStatus.FAILED, outcome.getDeliveryStatus());
        assertEquals(3, outcome.getAttempts());
        assertEquals(NOW, outcome.getRecordedAt());
    }
}
