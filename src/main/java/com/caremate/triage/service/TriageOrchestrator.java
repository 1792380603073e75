package com.caremate.triage.service;

import com.caremate.triage.component.ResponsePhrases;
import com.caremate.triage.component.StaffAssignment;
import com.caremate.triage.entity.ApprovalQueueEntry;
import com.caremate.triage.exception.AuditWriteException;
import com.caremate.triage.exception.PolicyInvariantViolationException;
import com.caremate.triage.triage.AuditSnapshot;
import com.caremate.triage.triage.Classification;
import com.caremate.triage.triage.NotificationRecord;
import com.caremate.triage.triage.PatientContext;
import com.caremate.triage.triage.PatientRequest;
import com.caremate.triage.triage.PolicyContext;
import com.caremate.triage.triage.PolicyDecision;
import com.caremate.triage.triage.TriageResult;
import com.caremate.triage.utils.DeliveryStatus;
import com.caremate.triage.utils.EscalationLevel;
import com.caremate.triage.utils.UrgencyLevel;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry for a bedside request: classify, apply policy, compose the reply, queue an approval if
 * needed, alert staff, and write the audit entry.
 * <p>
 * The decision stage is bounded by a deadline. Staff alerts are started but only waited on briefly;
 * recipients still in flight are audited as RETRYING and their final outcome goes to the notification
 * outcome store. Failures of the approval store or the alert fan-out flag the result for reconciliation
 * but never stop the audit write.
 */
@Service
public class TriageOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TriageOrchestrator.class);

    private final TriageClassifier classifier;
    private final PolicyEngine policyEngine;
    private final ResponseComposer responseComposer;
    private final NotificationDispatcher dispatcher;
    private final NotificationOutcomeService notificationOutcomeService;
    private final ApprovalQueueService approvalQueueService;
    private final AuditLogService auditLogService;
    private final PatientContextProvider patientContextProvider;
    private final RequestHistoryService requestHistoryService;
    private final StaffAssignment staffAssignment;
    private final ResponsePhrases phrases;
    private final Executor decisionExecutor;
    private final Clock clock;

    @Value("${caremate.decision.deadline-ms:2000}")
    private long decisionDeadlineMs = 2000;

    @Value("${caremate.notification.wait-ms:2000}")
    private long notificationWaitMs = 2000;

    public TriageOrchestrator(TriageClassifier classifier,
                              PolicyEngine policyEngine,
                              ResponseComposer responseComposer,
                              NotificationDispatcher dispatcher,
                              NotificationOutcomeService notificationOutcomeService,
                              ApprovalQueueService approvalQueueService,
                              AuditLogService auditLogService,
                              PatientContextProvider patientContextProvider,
                              RequestHistoryService requestHistoryService,
                              StaffAssignment staffAssignment,
                              ResponsePhrases phrases,
                              @Qualifier("decisionExecutor") Executor decisionExecutor,
                              Clock clock) {
        this.classifier = classifier;
        this.policyEngine = policyEngine;
        this.responseComposer = responseComposer;
        this.dispatcher = dispatcher;
        this.notificationOutcomeService = notificationOutcomeService;
        this.approvalQueueService = approvalQueueService;
        this.auditLogService = auditLogService;
        this.patientContextProvider = patientContextProvider;
        this.requestHistoryService = requestHistoryService;
        this.staffAssignment = staffAssignment;
        this.phrases = phrases;
        this.decisionExecutor = decisionExecutor;
        this.clock = clock;
    }

    public TriageResult process(String text, String patientId, String bedId) {
        return process(text, patientId, bedId, null);
    }

    /**
     * @param requestedPriority overrides the derived priority when not null
     * @throws IllegalArgumentException if {@code patientId} is blank
     * @throws PolicyInvariantViolationException if the decision contradicts its classification
     */
    public TriageResult process(String text, String patientId, String bedId, UrgencyLevel requestedPriority) {
        if (StringUtils.isBlank(patientId)) {
            throw new IllegalArgumentException("patientId is required");
        }
        PatientRequest request = PatientRequest.received(patientId.trim(), bedId, text, clock.instant());
        String requestId = request.getId();
        Optional<PatientContext> patient = patientContext(request);
        List<String> history = recentHistory(request);

        Decision decided = decide(request, patient, history);
        Classification classification = decided.classification;
        PolicyDecision decision = decided.decision;
        UrgencyLevel priority = requestedPriority != null
                ? requestedPriority
                : priorityFor(classification, decision);
        log.info("[{}] {} / {} -> {} (approval={}, priority={}) {}", requestId,
                classification.getIntentCategory(), classification.getUrgencyLevel(),
                decision.getEscalationLevel(), decision.isRequiresApproval(), priority,
                decision.getApplicablePolicies());

        boolean reconciliationRequired = false;
        String approvalEntryId = null;
        if (decision.isRequiresApproval()) {
            try {
                ApprovalQueueEntry entry = approvalQueueService.enqueue(decision, request, patient, priority);
                approvalEntryId = entry.getId();
            } catch (RuntimeException e) {
                log.error("[{}] Approval entry could not be stored", requestId, e);
                reconciliationRequired = true;
            }
        }

        List<NotificationDispatcher.PendingDelivery> pending;
        try {
            pending = notifyStaff(request, decision, patient, priority);
        } catch (RuntimeException e) {
            log.error("[{}] Staff alerts could not be started", requestId, e);
            pending = List.of();
            reconciliationRequired = true;
        }
        List<NotificationRecord> notifications = new ArrayList<>(pending.size());
        List<NotificationDispatcher.PendingDelivery> late = new ArrayList<>();
        for (NotificationDispatcher.PendingDelivery delivery : pending) {
            NotificationRecord record = delivery.outcomeOrInFlight(clock);
            notifications.add(record);
            if (record.getDeliveryStatus() == DeliveryStatus.RETRYING) {
                late.add(delivery);
            }
        }

        AuditSnapshot snapshot = new AuditSnapshot(request, classification, decision, decided.responseText,
                notifications, approvalEntryId);
        String auditId;
        try {
            auditId = auditLogService.record(snapshot);
        } catch (AuditWriteException e) {
            auditId = e.getAuditId();
            reconciliationRequired = true;
        }

        trackLateDeliveries(requestId, auditId, late);
        remember(request);

        return new TriageResult(requestId, classification, decision, decided.responseText, auditId,
                approvalEntryId, priority, notifications, reconciliationRequired);
    }

    /**
     * The higher of the classified urgency and the urgency the escalation implies.
     */
    static UrgencyLevel priorityFor(Classification classification, PolicyDecision decision) {
        UrgencyLevel implied;
        switch (decision.getEscalationLevel()) {
            case EMERGENCY:
                implied = UrgencyLevel.CRITICAL;
                break;
            case DOCTOR:
                implied = UrgencyLevel.HIGH;
                break;
            case NURSE:
                implied = UrgencyLevel.MEDIUM;
                break;
            default:
                implied = UrgencyLevel.LOW;
        }
        return UrgencyLevel.max(classification.getUrgencyLevel(), implied);
    }

    private Decision decide(PatientRequest request, Optional<PatientContext> patient, List<String> history) {
        PolicyContext context = new PolicyContext(request.getText(), patient.orElse(null));
        CompletableFuture<Decision> stage = CompletableFuture.supplyAsync(
                () -> decide(classifier.classify(request.getText(), history), context), decisionExecutor);
        try {
            return stage.get(decisionDeadlineMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            stage.cancel(true);
            log.error("[{}] Decision stage missed its {} ms deadline, using fail-safe classification",
                    request.getId(), decisionDeadlineMs);
            return decide(TriageClassifier.failSafe(), context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stage.cancel(true);
            log.error("[{}] Interrupted while deciding, using fail-safe classification", request.getId());
            return decide(TriageClassifier.failSafe(), context);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PolicyInvariantViolationException) {
                throw (PolicyInvariantViolationException) cause;
            }
            log.error("[{}] Decision stage failed, using fail-safe classification", request.getId(), cause);
            return decide(TriageClassifier.failSafe(), context);
        }
    }

    private Decision decide(Classification classification, PolicyContext context) {
        PolicyDecision decision = policyEngine.evaluate(classification, context);
        String response = responseComposer.compose(decision, classification.getIntentCategory(),
                context.getOriginalText());
        return new Decision(classification, decision, response);
    }

    private List<NotificationDispatcher.PendingDelivery> notifyStaff(PatientRequest request, PolicyDecision decision,
                                                               Optional<PatientContext> patient,
                                                               UrgencyLevel priority) {
        EscalationLevel level = decision.getEscalationLevel();
        List<String> recipients = staffAssignment.recipientsFor(level, patient);
        // nothing escalated: the nurse only sees it on the dashboard
        UrgencyLevel alertPriority = level == EscalationLevel.NONE ? UrgencyLevel.LOW : priority;
        String message = phrases.staffAlert(request.getPatientId(), request.getBedId(), level.name(), request.getText());

        List<NotificationDispatcher.PendingDelivery> pending =
                dispatcher.start(decision, recipients, alertPriority, request.getPatientId(), message);
        CompletableFuture<?>[] futures = pending.stream()
                .map(NotificationDispatcher.PendingDelivery::getFuture)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(futures).get(notificationWaitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.info("[{}] Some alerts still in flight after {} ms, auditing them as RETRYING",
                    request.getId(), notificationWaitMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("[{}] Alert task failed: {}", request.getId(), e.getCause().getMessage());
        }
        return pending;
    }

    private void trackLateDeliveries(String requestId, String auditId,
                                     List<NotificationDispatcher.PendingDelivery> late) {
        for (NotificationDispatcher.PendingDelivery delivery : late) {
            delivery.getFuture().whenComplete((record, error) -> {
                if (record == null) {
                    log.error("[{}] Late alert to {} ended without an outcome", requestId,
                            delivery.getRecipientId(), error);
                    return;
                }
                try {
                    notificationOutcomeService.recordFinal(requestId, auditId, record);
                } catch (RuntimeException e) {
                    log.error("[{}] Final outcome {} for {} could not be stored", requestId,
                            record.getDeliveryStatus(), record.getRecipientId(), e);
                }
            });
        }
    }

    private Optional<PatientContext> patientContext(PatientRequest request) {
        try {
            return patientContextProvider.lookup(request.getPatientId());
        } catch (RuntimeException e) {
            log.warn("[{}] Patient context unavailable, on-duty staff will be used: {}", request.getId(),
                    e.getMessage());
            return Optional.empty();
        }
    }

    private List<String> recentHistory(PatientRequest request) {
        try {
            return requestHistoryService.recentRequests(request.getPatientId());
        } catch (RuntimeException e) {
            log.warn("[{}] Request history unavailable: {}", request.getId(), e.getMessage());
            return List.of();
        }
    }

    private void remember(PatientRequest request) {
        if (StringUtils.isBlank(request.getText())) {
            return;
        }
        try {
            requestHistoryService.append(request.getPatientId(), request.getId(), request.getText());
        } catch (RuntimeException e) {
            log.warn("[{}] Failed to persist request history", request.getId(), e);
        }
    }

    private static final class Decision {
        final Classification classification;
        final PolicyDecision decision;
        final String responseText;

        Decision(Classification classification, PolicyDecision decision, String responseText) {
            this.classification = classification;
            this.decision = decision;
            this.responseText = responseText;
        }
    }
}
