package com.caremate.triage.utils;

/**
 * Outcome recorded on an audit entry at the time the request was processed.
 */
public enum ResolutionStatus {
    COMPLETED,
    PENDING,
    ESCALATED
}
