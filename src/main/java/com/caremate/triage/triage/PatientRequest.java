package com.caremate.triage.triage;

import com.caremate.triage.utils.IdGenerator;

import java.time.Instant;
import java.util.Objects;

/**
 * A single free-text request from a bedside device. Immutable once created.
 */
public final class PatientRequest {

    private final String id;
    private final String patientId;
    private final String bedId;
    private final String text;
    private final Instant receivedAt;

    public PatientRequest(String id, String patientId, String bedId, String text, Instant receivedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.patientId = Objects.requireNonNull(patientId, "patientId");
        this.bedId = bedId;
        this.text = text != null ? text : "";
        this.receivedAt = Objects.requireNonNull(receivedAt, "receivedAt");
    }

    public static PatientRequest received(String patientId, String bedId, String text, Instant now) {
        return new PatientRequest(IdGenerator.next(IdGenerator.REQUEST_PREFIX, now), patientId, bedId, text, now);
    }

    public String getId() {
        return id;
    }

    public String getPatientId() {
        return patientId;
    }

    public String getBedId() {
        return bedId;
    }

    public String getText() {
        return text;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }
}
