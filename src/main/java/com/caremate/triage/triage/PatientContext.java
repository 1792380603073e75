package com.caremate.triage.triage;

import java.util.List;

/**
 * Read-only view of a patient record as seen by the triage pipeline.
 */
public final class PatientContext {

    private final String hospitalId;
    private final String name;
    private final String bedNumber;
    private final List<String> medications;
    private final List<String> allergies;
    private final List<String> restrictions;
    private final String assignedNurseId;
    private final String assignedPhysicianId;

    public PatientContext(String hospitalId, String name, String bedNumber,
                          List<String> medications, List<String> allergies, List<String> restrictions,
                          String assignedNurseId, String assignedPhysicianId) {
        this.hospitalId = hospitalId;
        this.name = name;
        this.bedNumber = bedNumber;
        this.medications = medications != null ? List.copyOf(medications) : List.of();
        this.allergies = allergies != null ? List.copyOf(allergies) : List.of();
        this.restrictions = restrictions != null ? List.copyOf(restrictions) : List.of();
        this.assignedNurseId = assignedNurseId;
        this.assignedPhysicianId = assignedPhysicianId;
    }

    public String getHospitalId() {
        return hospitalId;
    }

    public String getName() {
        return name;
    }

    public String getBedNumber() {
        return bedNumber;
    }

    public List<String> getMedications() {
        return medications;
    }

    public List<String> getAllergies() {
        return allergies;
    }

    public List<String> getRestrictions() {
        return restrictions;
    }

    public String getAssignedNurseId() {
        return assignedNurseId;
    }

    public String getAssignedPhysicianId() {
        return assignedPhysicianId;
    }
}
