package com.caremate.triage.triage;

import com.caremate.triage.utils.EscalationLevel;
import com.caremate.triage.utils.ResolutionStatus;

import java.util.List;
import java.util.Objects;

/**
 * Everything known about a processed request at the moment it is audited.
 */
public final class AuditSnapshot {

    private final PatientRequest request;
    private final Classification classification;
    private final PolicyDecision decision;
    private final String responseText;
    private final List<NotificationRecord> notifications;
    private final String approvalEntryId;
    private final ResolutionStatus resolutionStatus;

    public AuditSnapshot(PatientRequest request, Classification classification, PolicyDecision decision,
                         String responseText, List<NotificationRecord> notifications, String approvalEntryId) {
        this.request = Objects.requireNonNull(request, "request");
        this.classification = Objects.requireNonNull(classification, "classification");
        this.decision = Objects.requireNonNull(decision, "decision");
        this.responseText = responseText != null ? responseText : "";
        this.notifications = notifications != null ? List.copyOf(notifications) : List.of();
        this.approvalEntryId = approvalEntryId;
        this.resolutionStatus = resolutionFor(decision);
    }

    static ResolutionStatus resolutionFor(PolicyDecision decision) {
        if (decision.getEscalationLevel() == EscalationLevel.EMERGENCY) {
            return ResolutionStatus.ESCALATED;
        }
        return decision.isRequiresApproval() ? ResolutionStatus.PENDING : ResolutionStatus.COMPLETED;
    }

    public PatientRequest getRequest() {
        return request;
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

    public List<NotificationRecord> getNotifications() {
        return notifications;
    }

    public String getApprovalEntryId() {
        return approvalEntryId;
    }

    public ResolutionStatus getResolutionStatus() {
        return resolutionStatus;
    }
}
