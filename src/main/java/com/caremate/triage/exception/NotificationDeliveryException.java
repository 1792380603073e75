package com.caremate.triage.exception;

import com.caremate.triage.utils.NotificationChannelType;

public class NotificationDeliveryException extends RuntimeException {

    private final NotificationChannelType channel;
    private final String recipientId;

    public NotificationDeliveryException(NotificationChannelType channel, String recipientId, String message) {
        super(channel + " delivery to " + recipientId + " failed: " + message);
        this.channel = channel;
        this.recipientId = recipientId;
    }

    public NotificationDeliveryException(NotificationChannelType channel, String recipientId, Throwable cause) {
        super(channel + " delivery to " + recipientId + " failed: " + cause.getMessage(), cause);
        this.channel = channel;
        this.recipientId = recipientId;
    }

    public NotificationChannelType getChannel() {
        return channel;
    }

    public String getRecipientId() {
        return recipientId;
    }
}
