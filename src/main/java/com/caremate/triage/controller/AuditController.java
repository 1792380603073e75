package com.caremate.triage.controller;

import com.caremate.triage.entity.AuditEntry;
import com.caremate.triage.entity.NotificationOutcome;
import com.caremate.triage.exception.AuditEntryNotFoundException;
import com.caremate.triage.service.AuditAlertService;
import com.caremate.triage.service.AuditLogService;
import com.caremate.triage.service.NotificationOutcomeService;
import com.caremate.triage.triage.AuditSnapshot;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditLogService auditLogService;
    private final AuditAlertService auditAlertService;
    private final NotificationOutcomeService notificationOutcomeService;

    public AuditController(AuditLogService auditLogService, AuditAlertService auditAlertService,
                           NotificationOutcomeService notificationOutcomeService) {
        this.auditLogService = auditLogService;
        this.auditAlertService = auditAlertService;
        this.notificationOutcomeService = notificationOutcomeService;
    }

    @GetMapping("/{id}")
    public AuditEntry get(@PathVariable("id") String id) {
        return auditLogService.get(id);
    }

    @GetMapping
    public List<AuditEntry> byPatient(@RequestParam("patientId") String patientId) {
        return auditLogService.listByPatient(patientId);
    }

    /** Final outcomes of alerts that were still in flight when the entry was written. */
    @GetMapping("/{id}/notifications")
    public List<NotificationOutcome> lateNotifications(@PathVariable("id") String id) {
        return notificationOutcomeService.listByAudit(id);
    }

    /** Audit ids that failed to persist and still need manual reconciliation. */
    @GetMapping("/reconciliation")
    public List<String> reconciliation() {
        return auditAlertService.pendingReconciliation();
    }

    @GetMapping("/reconciliation/{id}")
    public AuditSnapshot heldSnapshot(@PathVariable("id") String id) {
        AuditSnapshot snapshot = auditAlertService.snapshotFor(id);
        if (snapshot == null) {
            throw new AuditEntryNotFoundException(id);
        }
        return snapshot;
    }

    /** Re-attempts the write of a held snapshot. */
    @PostMapping("/reconciliation/{id}")
    public AuditEntry reconcile(@PathVariable("id") String id) {
        return auditLogService.reconcile(id);
    }
}
