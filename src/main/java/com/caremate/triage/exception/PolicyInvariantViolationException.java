package com.caremate.triage.exception;

/**
 * A policy decision that contradicts its classification reached the response stage.
 * This is a pipeline defect, never a data problem.
 */
public class PolicyInvariantViolationException extends RuntimeException {

    public PolicyInvariantViolationException(String message) {
        super(message);
    }
}
