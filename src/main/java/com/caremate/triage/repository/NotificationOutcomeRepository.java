package com.caremate.triage.repository;

import com.caremate.triage.entity.NotificationOutcome;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface NotificationOutcomeRepository extends JpaRepository<NotificationOutcome, Long> {

    List<NotificationOutcome> findByAuditIdOrderByRecordedAtAsc(String auditId);
}
