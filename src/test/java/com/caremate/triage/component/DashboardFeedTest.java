package com.caremate.triage.component;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DashboardFeedTest {

    @Test
    void keepsNewestFirstUpToCapacity() {
        DashboardFeed feed = new DashboardFeed(2);
        feed.append("N001", "a");
        feed.append("N001", "b");
        feed.append("N001", "c");

        assertEquals(List.of("c", "b"), feed.recent("N001"));
        assertTrue(feed.recent("N002").isEmpty());
    }
}
