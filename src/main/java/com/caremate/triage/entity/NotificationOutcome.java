package com.caremate.triage.entity;

import com.caremate.triage.utils.DeliveryStatus;
import com.caremate.triage.utils.UrgencyLevel;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Final delivery outcome of an alert that was still in flight when its request was audited. Append-only;
 * the audit row keeps its RETRYING entry and this table carries what happened afterwards.
 */
@Entity
@Immutable
@Table(name = "notification_outcome", indexes = {
    @Index(name = "idx_outcome_audit", columnList = "audit_id"),
    @Index(name = "idx_outcome_request", columnList = "request_id")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationOutcome {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "notification_id", nullable = false, updatable = false, length = 40)
    private String notificationId;

    @Column(name = "request_id", nullable = false, updatable = false, length = 40)
    private String requestId;

    @Column(name = "audit_id", updatable = false, length = 40)
    private String auditId;

    @Column(name = "recipient_id", nullable = false, updatable = false, length = 50)
    private String recipientId;

    @Column(updatable = false, length = 60)
    private String channels;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private UrgencyLevel priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_status", nullable = false, updatable = false, length = 20)
    private DeliveryStatus deliveryStatus;

    @Column(updatable = false)
    private int attempts;

    @Column(name = "failure_reason", columnDefinition = "TEXT", updatable = false)
    private String failureReason;

    @Column(name = "sent_at", updatable = false)
    private Instant sentAt;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
