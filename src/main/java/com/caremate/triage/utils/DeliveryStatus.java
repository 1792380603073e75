package com.caremate.triage.utils;

public enum DeliveryStatus {
    SENT,
    FAILED,
    /** Delivery still in flight when the outcome was captured. */
    RETRYING
}
