package com.caremate.triage.component;

import com.caremate.triage.triage.PatientContext;
import com.caremate.triage.utils.EscalationLevel;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps a patient and an escalation level to the staff ids that must hear about it.
 * Patients without a record (or without an assignment) fall back to the on-duty staff.
 */
@Component
public class StaffAssignment {

    private final String fallbackNurseId;
    private final String fallbackPhysicianId;
    private final String emergencyTeamId;

    public StaffAssignment(
            @Value("${caremate.staff.fallback-nurse-id:NURSE_ON_DUTY}") String fallbackNurseId,
            @Value("${caremate.staff.fallback-physician-id:DR_ON_CALL}") String fallbackPhysicianId,
            @Value("${caremate.staff.emergency-team-id:RAPID_RESPONSE}") String emergencyTeamId) {
        this.fallbackNurseId = fallbackNurseId;
        this.fallbackPhysicianId = fallbackPhysicianId;
        this.emergencyTeamId = emergencyTeamId;
    }

    public String nurseFor(Optional<PatientContext> patient) {
        return patient.map(PatientContext::getAssignedNurseId)
                .filter(StringUtils::isNotBlank)
                .orElse(fallbackNurseId);
    }

    public String physicianFor(Optional<PatientContext> patient) {
        return patient.map(PatientContext::getAssignedPhysicianId)
                .filter(StringUtils::isNotBlank)
                .orElse(fallbackPhysicianId);
    }

    public String emergencyTeam() {
        return emergencyTeamId;
    }

    /**
     * NONE and NURSE reach the nurse only; DOCTOR adds the physician; EMERGENCY adds the rapid response team.
     */
    public List<String> recipientsFor(EscalationLevel level, Optional<PatientContext> patient) {
        List<String> recipients = new ArrayList<>();
        recipients.add(nurseFor(patient));
        if (level.isAtLeast(EscalationLevel.DOCTOR)) {
            recipients.add(physicianFor(patient));
        }
        if (level == EscalationLevel.EMERGENCY) {
            recipients.add(emergencyTeam());
        }
        return recipients;
    }
}
