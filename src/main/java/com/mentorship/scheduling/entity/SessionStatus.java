package com.mentorship.scheduling.entity;

/**
 * Lifecycle of a mentoring session. The wire value is the lower-case name.
 */
public enum SessionStatus {
    SCHEDULED,
    CONFIRMED,
    RESCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    /** Statuses that hold the session's (mentor, instant) against new bookings. */
    public boolean isSlotOccupying() {
        return switch (this) {
            case SCHEDULED, CONFIRMED, RESCHEDULED, IN_PROGRESS -> true;
            case COMPLETED, CANCELLED, NO_SHOW -> false;
        };
    }

    public String wireValue() {
        return name().toLowerCase();
    }

    public static SessionStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("status is required");
        }
        return SessionStatus.valueOf(value.trim().toUpperCase());
    }
}
