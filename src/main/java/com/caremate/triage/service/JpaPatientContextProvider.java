package com.caremate.triage.service;

import com.caremate.triage.entity.PatientRecord;
import com.caremate.triage.repository.PatientRecordRepository;
import com.caremate.triage.triage.PatientContext;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaPatientContextProvider implements PatientContextProvider {

    private static final Logger log = LoggerFactory.getLogger(JpaPatientContextProvider.class);

    private final PatientRecordRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<PatientContext> lookup(String hospitalId) {
        if (StringUtils.isBlank(hospitalId)) {
            return Optional.empty();
        }
        try {
            Optional<PatientContext> context = repository.findById(hospitalId).map(JpaPatientContextProvider::toContext);
            if (context.isEmpty()) {
                log.info("[{}] No patient record, on-duty staff will be used", hospitalId);
            }
            return context;
        } catch (DataAccessException e) {
            log.warn("[{}] Patient lookup failed, continuing without context: {}", hospitalId, e.getMessage());
            return Optional.empty();
        }
    }

    private static PatientContext toContext(PatientRecord record) {
        return new PatientContext(
                record.getHospitalId(),
                record.getName(),
                record.getBedNumber(),
                record.getMedications(),
                record.getAllergies(),
                record.getRestrictions(),
                record.getPrimaryNurseId(),
                record.getAttendingPhysicianId());
    }
}
