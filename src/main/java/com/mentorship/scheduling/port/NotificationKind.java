package com.mentorship.scheduling.port;

public enum NotificationKind {
    SESSION_REQUESTED,
    SESSION_CONFIRMED,
    SESSION_DECLINED,
    SESSION_RESCHEDULED,
    SESSION_MISSED,
    SESSION_CANCELLED;

    public String wireValue() {
        return name().toLowerCase();
    }
}
