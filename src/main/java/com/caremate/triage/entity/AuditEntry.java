package com.caremate.triage.entity;

import com.caremate.triage.utils.DistressLevel;
import com.caremate.triage.utils.EscalationLevel;
import com.caremate.triage.utils.IntentCategory;
import com.caremate.triage.utils.ResolutionStatus;
import com.caremate.triage.utils.UrgencyLevel;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * One row per processed request. Hibernate never issues an UPDATE for this entity.
 */
@Entity
@Immutable
@Table(name = "audit_log", indexes = {
    @Index(name = "idx_audit_patient", columnList = "patient_id"),
    @Index(name = "idx_audit_timestamp", columnList = "log_timestamp"),
    @Index(name = "idx_audit_request", columnList = "request_id", unique = true)
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditEntry {

    @Id
    @Column(name = "log_id", length = 40)
    private String logId;

    @Column(name = "log_timestamp", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "request_id", nullable = false, updatable = false, length = 40)
    private String requestId;

    @Column(name = "patient_id", nullable = false, updatable = false, length = 50)
    private String patientId;

    @Column(name = "bed_id", updatable = false, length = 30)
    private String bedId;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(name = "query_text", columnDefinition = "TEXT", updatable = false)
    private String queryText;

    @Enumerated(EnumType.STRING)
    @Column(name = "intent_category", nullable = false, updatable = false, length = 20)
    private IntentCategory intentCategory;

    @Enumerated(EnumType.STRING)
    @Column(name = "urgency_level", nullable = false, updatable = false, length = 20)
    private UrgencyLevel urgencyLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "distress_level", nullable = false, updatable = false, length = 20)
    private DistressLevel distressLevel;

    @Column(name = "confidence", nullable = false, updatable = false)
    private double confidence;

    @Column(name = "matched_keywords", columnDefinition = "TEXT", updatable = false)
    private String matchedKeywords;

    @Enumerated(EnumType.STRING)
    @Column(name = "escalation_level", nullable = false, updatable = false, length = 20)
    private EscalationLevel escalationLevel;

    @Column(name = "approval_required", nullable = false, updatable = false)
    private boolean approvalRequired;

    /** Serialized policy decision (JSON). */
    @Column(name = "policy_decision", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String policyDecision;

    @Column(name = "response_text", columnDefinition = "TEXT", updatable = false)
    private String responseText;

    /** JSON array of staff ids a notification was addressed to. */
    @Column(name = "staff_notified", columnDefinition = "TEXT", updatable = false)
    private String staffNotified;

    /** JSON array of notification records. */
    @Column(name = "notification_outcomes", columnDefinition = "TEXT", updatable = false)
    private String notificationOutcomes;

    @Column(name = "approval_entry_id", updatable = false, length = 40)
    private String approvalEntryId;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_status", nullable = false, updatable = false, length = 20)
    private ResolutionStatus resolutionStatus;
}
