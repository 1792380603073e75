package com.caremate.triage.utils;

/**
 * Time-sensitivity of a request. Also used as the priority of approvals and notifications.
 */
public enum UrgencyLevel {
    LOW(60),
    MEDIUM(30),
    HIGH(15),
    CRITICAL(5);

    private final int slaMinutes;

    UrgencyLevel(int slaMinutes) {
        this.slaMinutes = slaMinutes;
    }

    /** Minutes a pending approval at this priority may wait before it is breached. */
    public int slaMinutes() {
        return slaMinutes;
    }

    public boolean isAtLeast(UrgencyLevel other) {
        return compareTo(other) >= 0;
    }

    public static UrgencyLevel max(UrgencyLevel a, UrgencyLevel b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }
}
