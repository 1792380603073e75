package com.caremate.triage.component;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Most recent dashboard alerts per staff member, kept in memory so a dashboard that connects late
 * still sees what it missed.
 */
@Component
public class DashboardFeed {

    private final Map<String, Deque<String>> feeds = new ConcurrentHashMap<>();
    private final int capacity;

    public DashboardFeed(@Value("${caremate.dashboard.feed-capacity:50}") int capacity) {
        this.capacity = capacity;
    }

    public void append(String staffId, String payload) {
        Deque<String> feed = feeds.computeIfAbsent(staffId, key -> new ArrayDeque<>());
        synchronized (feed) {
            feed.addFirst(payload);
            while (feed.size() > capacity) {
                feed.removeLast();
            }
        }
    }

    /** Newest first. */
    public List<String> recent(String staffId) {
        Deque<String> feed = feeds.get(staffId);
        if (feed == null) {
            return Collections.emptyList();
        }
        synchronized (feed) {
            return new ArrayList<>(feed);
        }
    }

    public void clear(String staffId) {
        feeds.remove(staffId);
    }
}
