package com.caremate.triage.repository;

import com.caremate.triage.entity.RequestHistory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RequestHistoryRepository extends JpaRepository<RequestHistory, Long> {

    List<RequestHistory> findTop3ByPatientIdOrderByCreatedAtDesc(String patientId);
}
