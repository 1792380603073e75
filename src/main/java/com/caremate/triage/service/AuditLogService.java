package com.caremate.triage.service;

import com.caremate.triage.entity.AuditEntry;
import com.caremate.triage.exception.AuditEntryNotFoundException;
import com.caremate.triage.exception.AuditWriteException;
import com.caremate.triage.repository.AuditEntryRepository;
import com.caremate.triage.triage.AuditSnapshot;
import com.caremate.triage.triage.Classification;
import com.caremate.triage.triage.NotificationRecord;
import com.caremate.triage.triage.PatientRequest;
import com.caremate.triage.triage.PolicyDecision;
import com.caremate.triage.utils.IdGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Append-only audit trail. Every processed request produces exactly one entry; there is no update or
 * delete path.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditEntryRepository repository;
    private final AuditAlertService alertService;
    private final ObjectMapper mapper;
    private final Retry retry;
    private final Clock clock;

    public AuditLogService(AuditEntryRepository repository, AuditAlertService alertService, ObjectMapper mapper,
                           @Qualifier("auditRetry") Retry retry, Clock clock) {
        this.repository = repository;
        this.alertService = alertService;
        this.mapper = mapper;
        this.retry = retry;
        this.clock = clock;
    }

    /**
     * Writes the snapshot, retrying with backoff. Each attempt runs in its own transaction.
     *
     * @return the id of the persisted entry
     * @throws AuditWriteException once retries are exhausted; an audit alert has been raised by then
     */
    public String record(AuditSnapshot snapshot) {
        Instant now = clock.instant();
        return write(IdGenerator.next(IdGenerator.AUDIT_PREFIX, now), now, snapshot);
    }

    /**
     * Writes a snapshot held for reconciliation under the id it was first given, then clears the alert.
     *
     * @throws AuditEntryNotFoundException if no snapshot is held for {@code auditId}
     * @throws AuditWriteException if the write fails again; the snapshot stays held
     */
    public AuditEntry reconcile(String auditId) {
        AuditSnapshot snapshot = alertService.snapshotFor(auditId);
        if (snapshot == null) {
            throw new AuditEntryNotFoundException(auditId);
        }
        if (repository.existsById(auditId)) {
            log.info("[{}] Audit {} was already persisted", snapshot.getRequest().getId(), auditId);
        } else {
            write(auditId, clock.instant(), snapshot);
        }
        alertService.markReconciled(auditId);
        return get(auditId);
    }

    private String write(String auditId, Instant now, AuditSnapshot snapshot) {
        try {
            AuditEntry entry = toEntry(auditId, now, snapshot);
            Supplier<AuditEntry> write = Retry.decorateSupplier(retry, () -> repository.saveAndFlush(entry));
            write.get();
        } catch (RuntimeException e) {
            alertService.raise(auditId, snapshot, e);
            throw new AuditWriteException(auditId, e);
        }
        log.info("[{}] Audit {} written ({}, {})", snapshot.getRequest().getId(), auditId,
                snapshot.getDecision().getEscalationLevel(), snapshot.getResolutionStatus());
        return auditId;
    }

    @Transactional(readOnly = true)
    public AuditEntry get(String auditId) {
        return repository.findById(auditId).orElseThrow(() -> new AuditEntryNotFoundException(auditId));
    }

    /** Newest first. */
    @Transactional(readOnly = true)
    public List<AuditEntry> listByPatient(String patientId) {
        return repository.findByPatientIdOrderByTimestampDesc(patientId);
    }

    AuditEntry toEntry(String auditId, Instant now, AuditSnapshot snapshot) {
        PatientRequest request = snapshot.getRequest();
        Classification classification = snapshot.getClassification();
        PolicyDecision decision = snapshot.getDecision();

        Set<String> staffNotified = new LinkedHashSet<>();
        List<Map<String, Object>> outcomes = new ArrayList<>();
        for (NotificationRecord record : snapshot.getNotifications()) {
            staffNotified.add(record.getRecipientId());
            Map<String, Object> outcome = new LinkedHashMap<>();
            outcome.put("notificationId", record.getId());
            outcome.put("recipientId", record.getRecipientId());
            outcome.put("channels", record.getChannels());
            outcome.put("priority", record.getPriority());
            outcome.put("sentAt", record.getSentAt() != null ? record.getSentAt().toString() : null);
            outcome.put("deliveryStatus", record.getDeliveryStatus());
            outcome.put("attempts", record.getAttempts());
            outcome.put("failureReason", record.getFailureReason());
            outcomes.add(outcome);
        }

        Map<String, Object> decisionJson = new LinkedHashMap<>();
        decisionJson.put("requiresApproval", decision.isRequiresApproval());
        decisionJson.put("escalationLevel", decision.getEscalationLevel());
        decisionJson.put("applicablePolicies", decision.getApplicablePolicies());
        decisionJson.put("reasoning", decision.getReasoning());
        decisionJson.put("estimatedResponseSeconds", decision.getEstimatedResponseSeconds());

        return AuditEntry.builder()
                .logId(auditId)
                .timestamp(now)
                .requestId(request.getId())
                .patientId(request.getPatientId())
                .bedId(request.getBedId())
                .receivedAt(request.getReceivedAt())
                .queryText(request.getText())
                .intentCategory(classification.getIntentCategory())
                .urgencyLevel(classification.getUrgencyLevel())
                .distressLevel(classification.getDistressLevel())
                .confidence(classification.getConfidence())
                .matchedKeywords(toJson(classification.getMatchedKeywords()))
                .escalationLevel(decision.getEscalationLevel())
                .approvalRequired(decision.isRequiresApproval())
                .policyDecision(toJson(decisionJson))
                .responseText(snapshot.getResponseText())
                .staffNotified(toJson(staffNotified))
                .notificationOutcomes(toJson(outcomes))
                .approvalEntryId(snapshot.getApprovalEntryId())
                .resolutionStatus(snapshot.getResolutionStatus())
                .build();
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unserializable audit field", e);
        }
    }
}
