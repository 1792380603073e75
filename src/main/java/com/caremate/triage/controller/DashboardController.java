package com.caremate.triage.controller;

import com.caremate.triage.component.DashboardFeed;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {

    private final DashboardFeed feed;

    public DashboardController(DashboardFeed feed) {
        this.feed = feed;
    }

    /** Recent alert payloads for a staff member, newest first. */
    @GetMapping("/{staffId}/feed")
    public List<String> feed(@PathVariable("staffId") String staffId) {
        return feed.recent(staffId);
    }
}
