package com.caremate.triage.service;

import com.caremate.triage.config.ResilienceConfig;
import com.caremate.triage.entity.AuditEntry;
import com.caremate.triage.exception.AuditEntryNotFoundException;
import com.caremate.triage.exception.AuditWriteException;
import com.caremate.triage.repository.AuditEntryRepository;
import com.caremate.triage.triage.AuditSnapshot;
import com.caremate.triage.triage.Classification;
import com.caremate.triage.triage.NotificationRecord;
import com.caremate.triage.triage.PatientRequest;
import com.caremate.triage.triage.PolicyContext;
import com.caremate.triage.triage.PolicyDecision;
import com.caremate.triage.utils.NotificationChannelType;
import com.caremate.triage.utils.ResolutionStatus;
import com.caremate.triage.utils.UrgencyLevel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AuditLogServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private AuditEntryRepository repository;
    private AuditAlertService alertService;
    private AuditLogService service;

    @BeforeEach
    void setUp() {
        repository = mock(AuditEntryRepository.class);
        alertService = new AuditAlertService();
        service = new AuditLogService(repository, alertService, new ObjectMapper(),
                ResilienceConfig.exponential("test-audit", 3, 1), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static AuditSnapshot snapshot(String text) {
        TriageClassifier classifier = new TriageClassifier();
        Classification classification = classifier.classify(text, List.of());
        PolicyDecision decision = new PolicyEngine().evaluate(classification, PolicyContext.of(text));
        PatientRequest request = PatientRequest.received("P001", "101A", text, NOW);
        NotificationRecord sent = NotificationRecord.sent("N001", EnumSet.of(NotificationChannelType.DASHBOARD),
                UrgencyLevel.MEDIUM, NOW, 1);
        NotificationRecord failed = NotificationRecord.failed("D001", EnumSet.of(NotificationChannelType.DASHBOARD),
                UrgencyLevel.MEDIUM, NOW, 3, "DASHBOARD: unreachable");
        return new AuditSnapshot(request, classification, decision, "reply", List.of(sent, failed), "APR-1");
    }

    @Test
    void recordWritesOneEntryWithSerializedDecision() {
        when(repository.saveAndFlush(any(AuditEntry.class))).thenAnswer(inv -> inv.getArgument(0));

        String auditId = service.record(snapshot("Can I have my pain medication?"));

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(repository, times(1)).saveAndFlush(captor.capture());
        AuditEntry entry = captor.getValue();
        assertEquals(auditId, entry.getLogId());
        assertTrue(auditId.startsWith("LOG-20260302100000-"));
        assertEquals(NOW, entry.getTimestamp());
        assertEquals("P001", entry.getPatientId());
        assertTrue(entry.isApprovalRequired());
        assertEquals(ResolutionStatus.PENDING, entry.getResolutionStatus());
        assertEquals("APR-1", entry.getApprovalEntryId());
        assertTrue(entry.getPolicyDecision().contains("MEDICATION_REQUEST_NURSE_REQUIRED"));
        assertEquals("[\"N001\",\"D001\"]", entry.getStaffNotified());
        assertTrue(entry.getNotificationOutcomes().contains("\"deliveryStatus\":\"FAILED\""));
    }

    @Test
    void transientFailureIsRetried() {
        when(repository.saveAndFlush(any(AuditEntry.class)))
                .thenThrow(new DataAccessResourceFailureException("connection reset"))
                .thenAnswer(inv -> inv.getArgument(0));

        String auditId = service.record(snapshot("Can I have some water?"));

        assertNotNull(auditId);
        verify(repository, times(2)).saveAndFlush(any(AuditEntry.class));
        assertTrue(alertService.pendingReconciliation().isEmpty());
    }

    @Test
    void exhaustedRetriesRaiseAlertAndQueueForReconciliation() {
        when(repository.saveAndFlush(any(AuditEntry.class)))
                .thenThrow(new DataAccessResourceFailureException("database down"));
        AuditSnapshot snapshot = snapshot("I'm having severe chest pain");

        AuditWriteException ex = assertThrows(AuditWriteException.class, () -> service.record(snapshot));

        verify(repository, times(3)).saveAndFlush(any(AuditEntry.class));
        assertEquals(List.of(ex.getAuditId()), alertService.pendingReconciliation());
        assertSame(snapshot, alertService.snapshotFor(ex.getAuditId()));
        assertTrue(alertService.markReconciled(ex.getAuditId()));
        assertTrue(alertService.pendingReconciliation().isEmpty());
    }

    @Test
    void emergencyIsAuditedAsEscalated() {
        when(repository.saveAndFlush(any(AuditEntry.class))).thenAnswer(inv -> inv.getArgument(0));

        service.record(snapshot("I'm having severe chest pain and I can't breathe"));

        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(repository).saveAndFlush(captor.capture());
        assertEquals(ResolutionStatus.ESCALATED, captor.getValue().getResolutionStatus());
    }

    @Test
    void reconcileWritesHeldSnapshotUnderItsOriginalId() {
        when(repository.saveAndFlush(any(AuditEntry.class)))
                .thenThrow(new DataAccessResourceFailureException("database down"))
                .thenThrow(new DataAccessResourceFailureException("database down"))
                .thenThrow(new DataAccessResourceFailureException("database down"))
                .thenAnswer(inv -> inv.getArgument(0));
        AuditWriteException ex = assertThrows(AuditWriteException.class,
                () -> service.record(snapshot("Can I have my pain medication?")));
        String auditId = ex.getAuditId();
        when(repository.existsById(auditId)).thenReturn(false);
        when(repository.findById(auditId)).thenAnswer(inv -> Optional.of(AuditEntry.builder().logId(auditId).build()));

        AuditEntry entry = service.reconcile(auditId);

        assertEquals(auditId, entry.getLogId());
        ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
        verify(repository, times(4)).saveAndFlush(captor.capture());
        assertEquals(auditId, captor.getValue().getLogId());
        assertTrue(alertService.pendingReconciliation().isEmpty());
    }

    @Test
    void failedReconcileKeepsSnapshotHeld() {
        when(repository.saveAndFlush(any(AuditEntry.class)))
                .thenThrow(new DataAccessResourceFailureException("database down"));
        AuditWriteException ex = assertThrows(AuditWriteException.class,
                () -> service.record(snapshot("Can I have some water?")));

        assertThrows(AuditWriteException.class, () -> service.reconcile(ex.getAuditId()));

        assertEquals(List.of(ex.getAuditId()), alertService.pendingReconciliation());
    }

    @Test
    void reconcileSkipsWriteWhenEntryAlreadyExists() {
        when(repository.saveAndFlush(any(AuditEntry.class)))
                .thenThrow(new DataAccessResourceFailureException("commit acknowledgement lost"));
        AuditWriteException ex = assertThrows(AuditWriteException.class,
                () -> service.record(snapshot("Can I have some water?")));
        String auditId = ex.getAuditId();
        when(repository.existsById(auditId)).thenReturn(true);
        when(repository.findById(auditId)).thenReturn(Optional.of(AuditEntry.builder().logId(auditId).build()));

        service.reconcile(auditId);

        verify(repository, times(3)).saveAndFlush(any(AuditEntry.class));
        assertTrue(alertService.pendingReconciliation().isEmpty());
    }

    @Test
    void reconcileOfUnknownIdIsNotFound() {
        assertThrows(AuditEntryNotFoundException.class, () -> service.reconcile("LOG-unknown"));
    }

    @Test
    void unknownAuditIdIsNotFound() {
        when(repository.findById("LOG-x")).thenReturn(Optional.empty());

        assertThrows(AuditEntryNotFoundException.class, () -> service.get("LOG-x"));
    }
}
