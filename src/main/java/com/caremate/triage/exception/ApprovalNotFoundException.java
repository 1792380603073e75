package com.caremate.triage.exception;

public class ApprovalNotFoundException extends RuntimeException {

    public ApprovalNotFoundException(String entryId) {
        super("No approval entry with id " + entryId);
    }
}
