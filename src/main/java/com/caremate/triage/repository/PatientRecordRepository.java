package com.caremate.triage.repository;

import com.caremate.triage.entity.PatientRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PatientRecordRepository extends JpaRepository<PatientRecord, String> {
}
