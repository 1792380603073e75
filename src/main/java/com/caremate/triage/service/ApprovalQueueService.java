package com.caremate.triage.service;

import com.caremate.triage.component.StaffAssignment;
import com.caremate.triage.entity.ApprovalQueueEntry;
import com.caremate.triage.exception.ApprovalNotFoundException;
import com.caremate.triage.exception.InvalidStateException;
import com.caremate.triage.repository.ApprovalQueueRepository;
import com.caremate.triage.triage.PatientContext;
import com.caremate.triage.triage.PatientRequest;
import com.caremate.triage.triage.PolicyDecision;
import com.caremate.triage.utils.ApprovalStatus;
import com.caremate.triage.utils.IdGenerator;
import com.caremate.triage.utils.UrgencyLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Requests that need a clinician's sign-off before anyone acts on them.
 */
@Service
public class ApprovalQueueService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalQueueService.class);

    private final ApprovalQueueRepository repository;
    private final StaffAssignment staffAssignment;
    private final Clock clock;

    public ApprovalQueueService(ApprovalQueueRepository repository, StaffAssignment staffAssignment, Clock clock) {
        this.repository = repository;
        this.staffAssignment = staffAssignment;
        this.clock = clock;
    }

    /**
     * Queues a request whose decision requires approval. Medication requests always go to the primary
     * nurse; other CRITICAL requests go to the attending physician; everything else to the primary nurse.
     */
    @Transactional
    public ApprovalQueueEntry enqueue(PolicyDecision decision, PatientRequest request,
                                      Optional<PatientContext> patient, UrgencyLevel priority) {
        Objects.requireNonNull(priority, "priority");
        if (!decision.isRequiresApproval()) {
            throw new IllegalArgumentException("Decision for " + request.getId() + " does not require approval");
        }
        boolean medication = decision.isMedicationRequest();
        String assignee;
        if (medication) {
            assignee = staffAssignment.nurseFor(patient);
        } else if (priority == UrgencyLevel.CRITICAL) {
            assignee = staffAssignment.physicianFor(patient);
        } else {
            assignee = staffAssignment.nurseFor(patient);
        }

        Instant now = clock.instant();
        int slaMinutes = priority.slaMinutes();
        ApprovalQueueEntry entry = ApprovalQueueEntry.builder()
                .id(IdGenerator.next(IdGenerator.APPROVAL_PREFIX, now))
                .requestId(request.getId())
                .patientId(request.getPatientId())
                .bedId(request.getBedId())
                .requestType(medication ? ApprovalQueueEntry.RequestType.MEDICATION : ApprovalQueueEntry.RequestType.MEDICAL)
                .queryText(request.getText())
                .status(ApprovalStatus.PENDING)
                .assignedStaffId(assignee)
                .priority(priority)
                .slaMinutes(slaMinutes)
                .createdAt(now)
                .slaDeadline(now.plus(Duration.ofMinutes(slaMinutes)))
                .build();
        ApprovalQueueEntry saved = repository.save(entry);
        log.info("[{}] Approval {} queued for {} ({}, SLA {} min)", request.getId(), saved.getId(), assignee,
                priority, slaMinutes);
        return saved;
    }

    /**
     * Moves a pending entry to APPROVED or REJECTED. The row is locked for the check and the update so two
     * clinicians resolving the same entry cannot both succeed.
     *
     * @throws IllegalArgumentException if {@code outcome} is not APPROVED or REJECTED
     * @throws ApprovalNotFoundException if no entry has that id
     * @throws InvalidStateException if the entry was already resolved; the entry is left untouched
     */
    @Transactional
    public ApprovalQueueEntry resolve(String entryId, ApprovalStatus outcome, String staffId, String notes) {
        if (outcome == null || !outcome.isTerminal()) {
            throw new IllegalArgumentException("Outcome must be APPROVED or REJECTED, got " + outcome);
        }
        ApprovalQueueEntry entry = repository.findByIdForUpdate(entryId)
                .orElseThrow(() -> new ApprovalNotFoundException(entryId));
        if (!entry.isPending()) {
            throw new InvalidStateException(entryId, entry.getStatus());
        }
        entry.setStatus(outcome);
        entry.setResolvedAt(clock.instant());
        entry.setResolvedBy(staffId);
        entry.setResolutionNotes(notes);
        ApprovalQueueEntry saved = repository.save(entry);
        log.info("Approval {} {} by {}", entryId, outcome, staffId);
        return saved;
    }

    @Transactional(readOnly = true)
    public ApprovalQueueEntry get(String entryId) {
        return repository.findById(entryId).orElseThrow(() -> new ApprovalNotFoundException(entryId));
    }

    /** Pending entries, most urgent deadline first. */
    @Transactional(readOnly = true)
    public List<ApprovalQueueEntry> listPending() {
        return repository.findByStatusOrderBySlaDeadlineAsc(ApprovalStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public List<ApprovalQueueEntry> listByPatient(String patientId) {
        return repository.findByPatientIdOrderByCreatedAtDesc(patientId);
    }

    /**
     * Stamps every pending entry past its deadline that has not been stamped yet.
     *
     * @return the entries stamped by this call
     */
    @Transactional
    public List<ApprovalQueueEntry> markSlaBreaches(Instant now) {
        List<ApprovalQueueEntry> breached = new ArrayList<>();
        for (ApprovalQueueEntry entry : repository.findBreached(ApprovalStatus.PENDING, now)) {
            entry.setSlaBreachedAt(now);
            breached.add(repository.save(entry));
        }
        return breached;
    }
}
