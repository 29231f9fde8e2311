package com.mentorship.scheduling.session;

import java.util.EnumSet;
import java.util.Set;

public enum SessionAction {
    /** Mentor accepts a requested session. */
    ACCEPT,
    /** Mentor turns a request down. */
    DECLINE,
    /** Mentor declines the requested time and proposes another. */
    RESCHEDULE,
    ACCEPT_RESCHEDULE,
    DECLINE_RESCHEDULE,
    CONFIRM_ATTENDANCE,
    CANCEL,
    START,
    COMPLETE,
    MARK_MISSED;

    public Set<Actor> permittedActors() {
        return switch (this) {
            case ACCEPT, DECLINE, RESCHEDULE -> EnumSet.of(Actor.MENTOR);
            case ACCEPT_RESCHEDULE, DECLINE_RESCHEDULE -> EnumSet.of(Actor.MENTEE);
            case CONFIRM_ATTENDANCE, CANCEL, START -> EnumSet.of(Actor.MENTOR, Actor.MENTEE);
            case COMPLETE -> EnumSet.allOf(Actor.class);
            case MARK_MISSED -> EnumSet.of(Actor.SYSTEM);
        };
    }
}
