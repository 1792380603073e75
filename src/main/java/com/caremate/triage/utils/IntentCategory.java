package com.caremate.triage.utils;

/**
 * What a patient request is about. Unclassifiable input defaults to MEDICAL.
 */
public enum IntentCategory {
    EMERGENCY,
    MEDICAL,
    NON_MEDICAL
}
