package com.caremate.triage.triage;

import java.util.Optional;

/**
 * The minimal context the policy engine sees besides the classification.
 */
public final class PolicyContext {

    private final String originalText;
    private final PatientContext patient;

    public PolicyContext(String originalText, PatientContext patient) {
        this.originalText = originalText != null ? originalText : "";
        this.patient = patient;
    }

    public static PolicyContext of(String originalText) {
        return new PolicyContext(originalText, null);
    }

    public String getOriginalText() {
        return originalText;
    }

    public Optional<PatientContext> getPatient() {
        return Optional.ofNullable(patient);
    }
}
