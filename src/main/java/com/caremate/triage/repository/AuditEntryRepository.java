package com.caremate.triage.repository;

import com.caremate.triage.entity.AuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditEntryRepository extends JpaRepository<AuditEntry, String> {

    List<AuditEntry> findByPatientIdOrderByTimestampDesc(String patientId);
}
