package com.caremate.triage.entity;

import com.caremate.triage.utils.ApprovalStatus;
import com.caremate.triage.utils.UrgencyLevel;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "approval_queue", indexes = {
    @Index(name = "idx_approval_status_deadline", columnList = "status, sla_deadline"),
    @Index(name = "idx_approval_patient", columnList = "patient_id"),
    @Index(name = "idx_approval_request", columnList = "request_id", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApprovalQueueEntry {

    public enum RequestType { MEDICATION, MEDICAL }

    @Id
    @Column(length = 40)
    private String id;

    @Column(name = "request_id", nullable = false, updatable = false, length = 40)
    private String requestId;

    @Column(name = "patient_id", nullable = false, updatable = false, length = 50)
    private String patientId;

    @Column(name = "bed_id", updatable = false, length = 30)
    private String bedId;

    @Enumerated(EnumType.STRING)
    @Column(name = "request_type", nullable = false, updatable = false, length = 20)
    private RequestType requestType;

    @Column(name = "query_text", columnDefinition = "TEXT", updatable = false)
    private String queryText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ApprovalStatus status = ApprovalStatus.PENDING;

    @Column(name = "assigned_staff_id", length = 50)
    private String assignedStaffId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UrgencyLevel priority;

    @Column(name = "sla_minutes", nullable = false)
    private int slaMinutes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "sla_deadline", nullable = false)
    private Instant slaDeadline;

    /** Set once by the SLA sweep; the entry stays PENDING. */
    @Column(name = "sla_breached_at")
    private Instant slaBreachedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolved_by", length = 50)
    private String resolvedBy;

    @Column(name = "resolution_notes", columnDefinition = "TEXT")
    private String resolutionNotes;

    @Version
    private Long version;

    public boolean isPending() {
        return status == ApprovalStatus.PENDING;
    }
}
