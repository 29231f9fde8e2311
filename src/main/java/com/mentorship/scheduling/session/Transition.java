package com.mentorship.scheduling.session;

import com.mentorship.scheduling.entity.SessionStatus;

/**
 * An accepted move through the session lifecycle.
 */
public record Transition(Actor actor, SessionAction action, SessionStatus from, SessionStatus to) {

    /** Repeating MARK_MISSED on a session already marked no_show. */
    public boolean isNoOp() {
        return action == SessionAction.MARK_MISSED && from == SessionStatus.NO_SHOW;
    }

    public boolean releasesSlot() {
        return from.isSlotOccupying() && !to.isSlotOccupying();
    }
}
