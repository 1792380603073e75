package com.caremate.triage.exception;

public class AuditEntryNotFoundException extends RuntimeException {

    public AuditEntryNotFoundException(String auditId) {
        super("No audit entry with id " + auditId);
    }
}
