package com.caremate.triage.service.channel;

import com.caremate.triage.exception.NotificationDeliveryException;
import com.caremate.triage.utils.NotificationChannelType;
import com.caremate.triage.utils.UrgencyLevel;

/**
 * One transport for staff alerts.
 */
public interface NotificationChannel {

    NotificationChannelType type();

    /**
     * Whether the transport has what it needs to send (credentials, gateway url).
     * Unconfigured channels are left out of a delivery rather than failing it.
     */
    default boolean isConfigured() {
        return true;
    }

    /**
     * @throws NotificationDeliveryException if the message could not be handed to the transport
     */
    void deliver(String recipientId, String message, UrgencyLevel priority);
}
