package com.caremate.triage.service;

import com.caremate.triage.triage.PatientContext;

import java.util.Optional;

/**
 * Read-only patient record lookup. A missing record and a failed lookup both come back empty.
 */
public interface PatientContextProvider {

    Optional<PatientContext> lookup(String hospitalId);
}
