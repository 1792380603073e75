package com.caremate.triage.service;

import com.caremate.triage.entity.ApprovalQueueEntry;
import com.caremate.triage.triage.SlaBreachEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class SlaBreachMonitor {

    private static final Logger log = LoggerFactory.getLogger(SlaBreachMonitor.class);

    private final ApprovalQueueService approvalQueueService;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    public SlaBreachMonitor(ApprovalQueueService approvalQueueService, ApplicationEventPublisher events, Clock clock) {
        this.approvalQueueService = approvalQueueService;
        this.events = events;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${caremate.approval.sla-sweep-interval-ms:30000}",
            initialDelayString = "${caremate.approval.sla-sweep-initial-delay-ms:30000}")
    public void sweep() {
        Instant now = clock.instant();
        List<ApprovalQueueEntry> breached;
        try {
            breached = approvalQueueService.markSlaBreaches(now);
        } catch (DataAccessException e) {
            log.error("SLA sweep failed, will retry on next run", e);
            return;
        }
        for (ApprovalQueueEntry entry : breached) {
            log.warn("Approval {} for patient {} breached its {} min SLA (deadline {})",
                    entry.getId(), entry.getPatientId(), entry.getSlaMinutes(), entry.getSlaDeadline());
            events.publishEvent(new SlaBreachEvent(entry.getId(), entry.getPatientId(), entry.getPriority(),
                    entry.getSlaMinutes(), now));
        }
    }
}
