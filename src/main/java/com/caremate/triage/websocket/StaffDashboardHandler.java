package com.caremate.triage.websocket;

import com.caremate.triage.component.DashboardFeed;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Staff dashboards connect to {@code /ws/staff-dashboard?staffId=...}. Alerts addressed to that
 * staff member are pushed as text frames; on connect the in-memory feed is replayed oldest first.
 */
@Component
public class StaffDashboardHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(StaffDashboardHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 5000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final Map<String, Set<WebSocketSession>> sessionsByStaff = new ConcurrentHashMap<>();
    private final DashboardFeed feed;

    public StaffDashboardHandler(DashboardFeed feed) {
        this.feed = feed;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String staffId = staffIdOf(session);
        if (StringUtils.isBlank(staffId)) {
            log.warn("Dashboard connection {} without staffId, closing", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("staffId query parameter is required"));
            return;
        }
        WebSocketSession concurrent =
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        session.getAttributes().put("staffId", staffId);
        session.getAttributes().put("concurrent", concurrent);
        sessionsByStaff.computeIfAbsent(staffId, key -> ConcurrentHashMap.newKeySet()).add(concurrent);
        log.info("Dashboard connected for {} (session {})", staffId, session.getId());

        List<String> missed = feed.recent(staffId);
        for (int i = missed.size() - 1; i >= 0; i--) {
            concurrent.sendMessage(new TextMessage(missed.get(i)));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // dashboards are receive-only; anything they send is ignored
        log.debug("Ignoring dashboard frame from session {}", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Object staffId = session.getAttributes().get("staffId");
        Object concurrent = session.getAttributes().get("concurrent");
        if (staffId == null || concurrent == null) {
            return;
        }
        Set<WebSocketSession> sessions = sessionsByStaff.get(staffId.toString());
        if (sessions != null) {
            sessions.remove(concurrent);
        }
        log.info("Dashboard disconnected for {} ({})", staffId, status);
    }

    /**
     * Sends a payload to every open dashboard of a staff member.
     *
     * @return the number of sessions the payload reached
     * @throws IOException if a session was open but the write failed
     */
    public int push(String staffId, String payload) throws IOException {
        Set<WebSocketSession> sessions = sessionsByStaff.get(staffId);
        if (sessions == null || sessions.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        IOException lastFailure = null;
        for (WebSocketSession session : sessions) {
            if (!session.isOpen()) {
                sessions.remove(session);
                continue;
            }
            try {
                session.sendMessage(new TextMessage(payload));
                delivered++;
            } catch (IOException e) {
                lastFailure = e;
                log.warn("Dashboard push to {} failed on session {}: {}", staffId, session.getId(), e.getMessage());
            }
        }
        if (delivered == 0 && lastFailure != null) {
            throw lastFailure;
        }
        return delivered;
    }

    public boolean isConnected(String staffId) {
        Set<WebSocketSession> sessions = sessionsByStaff.get(staffId);
        return sessions != null && !sessions.isEmpty();
    }

    private static String staffIdOf(WebSocketSession session) {
        URI uri = session.getUri();
        if (uri == null) {
            return null;
        }
        return UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("staffId");
    }
}
