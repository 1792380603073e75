package com.caremate.triage.triage;

import com.caremate.triage.utils.UrgencyLevel;

import java.util.List;

/**
 * What the caller of a triage run gets back.
 */
public final class TriageResult {

    private final String requestId;
    private final Classification classification;
    private final PolicyDecision decision;
    private final String responseText;
    private final String auditId;
    private final String approvalEntryId;
    private final UrgencyLevel priority;
    private final List<NotificationRecord> notifications;
    private final boolean reconciliationRequired;

    public TriageResult(String requestId, Classification classification, PolicyDecision decision,
                        String responseText, String auditId, String approvalEntryId, UrgencyLevel priority,
                        List<NotificationRecord> notifications, boolean reconciliationRequired) {
        this.requestId = requestId;
        this.classification = classification;
        this.decision = decision;
        this.responseText = responseText;
        this.auditId = auditId;
        this.approvalEntryId = approvalEntryId;
        this.priority = priority;
        this.notifications = notifications != null ? List.copyOf(notifications) : List.of();
        this.reconciliationRequired = reconciliationRequired;
    }

    public String getRequestId() {
        return requestId;
    }

    public Classification getClassification() {
        return classification;
    }

    public PolicyDecision getDecision() {
        return decision;
    }

    public String getResponseText() {
        return responseText;
    }

    public String getAuditId() {
        return auditId;
    }

    public String getApprovalEntryId() {
        return approvalEntryId;
    }

    public UrgencyLevel getPriority() {
        return priority;
    }

    public List<NotificationRecord> getNotifications() {
        return notifications;
    }

    /** True when the audit entry or the approval entry could not be stored and must be fixed by hand. */
    public boolean isReconciliationRequired() {
        return reconciliationRequired;
    }
}
