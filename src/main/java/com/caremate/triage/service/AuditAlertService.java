package com.caremate.triage.service;

import com.caremate.triage.triage.AuditSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Out-of-band alarm for audit records that could not be written. Alerts carry the {@code AUDIT_ALERT}
 * marker so log routing can page someone; the snapshot is held until it is reconciled by hand.
 */
@Service
public class AuditAlertService {

    private static final Logger log = LoggerFactory.getLogger(AuditAlertService.class);

    public static final Marker AUDIT_ALERT = MarkerFactory.getMarker("AUDIT_ALERT");

    private final Map<String, AuditSnapshot> awaitingReconciliation = new ConcurrentHashMap<>();

    public void raise(String auditId, AuditSnapshot snapshot, Throwable cause) {
        awaitingReconciliation.put(auditId, snapshot);
        log.error(AUDIT_ALERT, "Audit entry {} for request {} (patient {}) was NOT persisted; queued for reconciliation",
                auditId, snapshot.getRequest().getId(), snapshot.getRequest().getPatientId(), cause);
    }

    public List<String> pendingReconciliation() {
        return new ArrayList<>(awaitingReconciliation.keySet());
    }

    public AuditSnapshot snapshotFor(String auditId) {
        return awaitingReconciliation.get(auditId);
    }

    /** Called once the entry has been written by other means. */
    public boolean markReconciled(String auditId) {
        boolean removed = awaitingReconciliation.remove(auditId) != null;
        if (removed) {
            log.info(AUDIT_ALERT, "Audit entry {} reconciled", auditId);
        }
        return removed;
    }
}
