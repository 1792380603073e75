package com.caremate.triage.triage;

import com.caremate.triage.utils.UrgencyLevel;

import java.time.Instant;

/**
 * Published once per approval entry, the first time a sweep finds it pending past its deadline.
 */
public final class SlaBreachEvent {

    private final String entryId;
    private final String patientId;
    private final UrgencyLevel priority;
    private final int slaMinutes;
    private final Instant breachedAt;

    public SlaBreachEvent(String entryId, String patientId, UrgencyLevel priority, int slaMinutes, Instant breachedAt) {
        this.entryId = entryId;
        this.patientId = patientId;
        this.priority = priority;
        this.slaMinutes = slaMinutes;
        this.breachedAt = breachedAt;
    }

    public String getEntryId() {
        return entryId;
    }

    public String getPatientId() {
        return patientId;
    }

    public UrgencyLevel getPriority() {
        return priority;
    }

    public int getSlaMinutes() {
        return slaMinutes;
    }

    public Instant getBreachedAt() {
        return breachedAt;
    }

    @Override
    public String toString() {
        return "SlaBreachEvent{" + entryId + ", patient=" + patientId + ", " + priority + "}";
    }
}
