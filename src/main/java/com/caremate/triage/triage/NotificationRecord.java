package com.caremate.triage.triage;

import com.caremate.triage.utils.DeliveryStatus;
import com.caremate.triage.utils.IdGenerator;
import com.caremate.triage.utils.NotificationChannelType;
import com.caremate.triage.utils.UrgencyLevel;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Delivery outcome for one recipient.
 */
public final class NotificationRecord {

    private final String id;
    private final String recipientId;
    private final Set<NotificationChannelType> channels;
    private final UrgencyLevel priority;
    private final Instant sentAt;
    private final DeliveryStatus deliveryStatus;
    private final int attempts;
    private final String failureReason;

    public NotificationRecord(String id, String recipientId, Set<NotificationChannelType> channels,
                              UrgencyLevel priority, Instant sentAt, DeliveryStatus deliveryStatus,
                              int attempts, String failureReason) {
        this.id = id;
        this.recipientId = recipientId;
        this.channels = channels == null || channels.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(channels));
        this.priority = priority;
        this.sentAt = sentAt;
        this.deliveryStatus = deliveryStatus;
        this.attempts = attempts;
        this.failureReason = failureReason;
    }

    public static NotificationRecord sent(String recipientId, Set<NotificationChannelType> channels,
                                          UrgencyLevel priority, Instant at, int attempts) {
        return new NotificationRecord(IdGenerator.next(IdGenerator.NOTIFICATION_PREFIX, at), recipientId,
                channels, priority, at, DeliveryStatus.SENT, attempts, null);
    }

    public static NotificationRecord failed(String recipientId, Set<NotificationChannelType> channels,
                                            UrgencyLevel priority, Instant at, int attempts, String reason) {
        return new NotificationRecord(IdGenerator.next(IdGenerator.NOTIFICATION_PREFIX, at), recipientId,
                channels, priority, at, DeliveryStatus.FAILED, attempts, reason);
    }

    public static NotificationRecord inFlight(String recipientId, Set<NotificationChannelType> channels,
                                              UrgencyLevel priority, Instant at) {
        return new NotificationRecord(IdGenerator.next(IdGenerator.NOTIFICATION_PREFIX, at), recipientId,
                channels, priority, at, DeliveryStatus.RETRYING, 0, null);
    }

    public String getId() {
        return id;
    }

    public String getRecipientId() {
        return recipientId;
    }

    public Set<NotificationChannelType> getChannels() {
        return channels;
    }

    public UrgencyLevel getPriority() {
        return priority;
    }

    public Instant getSentAt() {
        return sentAt;
    }

    public DeliveryStatus getDeliveryStatus() {
        return deliveryStatus;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getFailureReason() {
        return failureReason;
    }
}
