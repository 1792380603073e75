package com.caremate.triage.repository;

import com.caremate.triage.entity.ApprovalQueueEntry;
import com.caremate.triage.utils.ApprovalStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ApprovalQueueRepository extends JpaRepository<ApprovalQueueEntry, String> {

    List<ApprovalQueueEntry> findByStatusOrderBySlaDeadlineAsc(ApprovalStatus status);

    List<ApprovalQueueEntry> findByPatientIdOrderByCreatedAtDesc(String patientId);

    @Query("SELECT e FROM ApprovalQueueEntry e WHERE e.status = :status AND e.slaDeadline < :now AND e.slaBreachedAt IS NULL")
    List<ApprovalQueueEntry> findBreached(@Param("status") ApprovalStatus status, @Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM ApprovalQueueEntry e WHERE e.id = :id")
    Optional<ApprovalQueueEntry> findByIdForUpdate(@Param("id") String id);
}
