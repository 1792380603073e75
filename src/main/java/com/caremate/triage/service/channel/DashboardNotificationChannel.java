package com.caremate.triage.service.channel;

import com.caremate.triage.component.DashboardFeed;
import com.caremate.triage.exception.NotificationDeliveryException;
import com.caremate.triage.utils.NotificationChannelType;
import com.caremate.triage.utils.UrgencyLevel;
import com.caremate.triage.websocket.StaffDashboardHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pushes the alert to any open dashboard of the staff member and keeps it in their feed. A staff
 * member with no dashboard open still has the alert waiting in the feed, so that counts as delivered.
 */
@Component
public class DashboardNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(DashboardNotificationChannel.class);

    private final DashboardFeed feed;
    private final StaffDashboardHandler dashboardHandler;
    private final ObjectMapper mapper;
    private final Clock clock;

    public DashboardNotificationChannel(DashboardFeed feed, StaffDashboardHandler dashboardHandler,
                                        ObjectMapper mapper, Clock clock) {
        this.feed = feed;
        this.dashboardHandler = dashboardHandler;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public NotificationChannelType type() {
        return NotificationChannelType.DASHBOARD;
    }

    @Override
    public void deliver(String recipientId, String message, UrgencyLevel priority) {
        String payload = toPayload(recipientId, message, priority);
        int sessions;
        try {
            sessions = dashboardHandler.push(recipientId, payload);
        } catch (IOException e) {
            throw new NotificationDeliveryException(type(), recipientId, e);
        }
        feed.append(recipientId, payload);
        log.debug("Dashboard alert for {} reached {} session(s)", recipientId, sessions);
    }

    private String toPayload(String recipientId, String message, UrgencyLevel priority) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("recipientId", recipientId);
        body.put("priority", priority.name());
        body.put("message", message);
        body.put("at", clock.instant().toString());
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new NotificationDeliveryException(type(), recipientId, e);
        }
    }
}
