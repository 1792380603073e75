package com.caremate.triage.component;

import com.caremate.triage.triage.PatientContext;
import com.caremate.triage.utils.EscalationLevel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StaffAssignmentTest {

    private final StaffAssignment assignment = new StaffAssignment("NURSE_ON_DUTY", "DR_ON_CALL", "RAPID_RESPONSE");
    private final Optional<PatientContext> patient = Optional.of(
            new PatientContext("P001", "John Smith", "101A", List.of(), List.of(), List.of(), "N001", "D001"));

    @Test
    void recipientsGrowWithEscalation() {
        assertEquals(List.of("N001"), assignment.recipientsFor(EscalationLevel.NONE, patient));
        assertEquals(List.of("N001"), assignment.recipientsFor(EscalationLevel.NURSE, patient));
        assertEquals(List.of("N001", "D001"), assignment.recipientsFor(EscalationLevel.DOCTOR, patient));
        assertEquals(List.of("N001", "D001", "RAPID_RESPONSE"), assignment.recipientsFor(EscalationLevel.EMERGENCY, patient));
    }

    @Test
    void missingAssignmentsFallBackToOnDutyStaff() {
        Optional<PatientContext> unassigned = Optional.of(
                new PatientContext("P009", null, null, null, null, null, " ", null));

        assertEquals(List.of("NURSE_ON_DUTY", "DR_ON_CALL"), assignment.recipientsFor(EscalationLevel.DOCTOR, unassigned));
        assertEquals(List.of("NURSE_ON_DUTY", "DR_ON_CALL", "RAPID_RESPONSE"),
                assignment.recipientsFor(EscalationLevel.EMERGENCY, Optional.empty()));
    }
}
