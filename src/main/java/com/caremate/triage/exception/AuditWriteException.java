package com.caremate.triage.exception;

public class AuditWriteException extends RuntimeException {

    private final String auditId;

    public AuditWriteException(String auditId, Throwable cause) {
        super("Audit entry " + auditId + " could not be written", cause);
        this.auditId = auditId;
    }

    public String getAuditId() {
        return auditId;
    }
}
