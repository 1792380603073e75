package com.caremate.triage.controller;

import com.caremate.triage.exception.ApprovalNotFoundException;
import com.caremate.triage.exception.AuditEntryNotFoundException;
import com.caremate.triage.exception.AuditWriteException;
import com.caremate.triage.exception.InvalidStateException;
import com.caremate.triage.exception.PolicyInvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({ApprovalNotFoundException.class, AuditEntryNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(RuntimeException ex) {
        return body(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidState(InvalidStateException ex) {
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.CONFLICT, "invalid_state", ex.getMessage());
        response.getBody().put("currentStatus", ex.getCurrentStatus());
        return response;
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(PolicyInvariantViolationException.class)
    public ResponseEntity<Map<String, Object>> handleInvariant(PolicyInvariantViolationException ex) {
        log.error("Policy invariant violated", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "policy_invariant_violation", ex.getMessage());
    }

    @ExceptionHandler(AuditWriteException.class)
    public ResponseEntity<Map<String, Object>> handleAuditWrite(AuditWriteException ex) {
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.SERVICE_UNAVAILABLE, "audit_write_failed",
                ex.getMessage());
        response.getBody().put("auditId", ex.getAuditId());
        return response;
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("details", details);
        return new ResponseEntity<>(body, status);
    }
}
