package com.caremate.triage.utils;

public enum DistressLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH
}
