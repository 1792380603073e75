package com.caremate.triage.utils;

/**
 * Staff tier a request is routed to. Declaration order is the escalation order.
 */
public enum EscalationLevel {
    NONE,
    NURSE,
    DOCTOR,
    EMERGENCY;

    public boolean isHigherThan(EscalationLevel other) {
        return compareTo(other) > 0;
    }

    public boolean isAtLeast(EscalationLevel other) {
        return compareTo(other) >= 0;
    }
}
