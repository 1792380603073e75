package com.caremate.triage.exception;

import com.caremate.triage.utils.ApprovalStatus;

/**
 * Raised when an approval entry is asked to move out of a terminal state.
 */
public class InvalidStateException extends RuntimeException {

    private final String entryId;
    private final ApprovalStatus currentStatus;

    public InvalidStateException(String entryId, ApprovalStatus currentStatus) {
        super("Approval entry " + entryId + " is already " + currentStatus);
        this.entryId = entryId;
        this.currentStatus = currentStatus;
    }

    public String getEntryId() {
        return entryId;
    }

    public ApprovalStatus getCurrentStatus() {
        return currentStatus;
    }
}
