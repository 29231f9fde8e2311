package com.mentorship.scheduling.exception;

import com.mentorship.scheduling.entity.SessionStatus;
import com.mentorship.scheduling.session.Actor;
import com.mentorship.scheduling.session.SessionAction;

public class InvalidTransitionException extends SchedulingException {

    public InvalidTransitionException(String message) {
        super(ErrorKind.INVALID_TRANSITION, message);
    }

    public InvalidTransitionException(Actor actor, SessionAction action, SessionStatus from) {
        this(actor.name().toLowerCase() + " cannot " + action.name().toLowerCase()
                + " a session that is " + from.wireValue());
    }
}
