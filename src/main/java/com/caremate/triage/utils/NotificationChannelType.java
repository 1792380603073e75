package com.caremate.triage.utils;

public enum NotificationChannelType {
    DASHBOARD,
    PUSH,
    SMS
}
