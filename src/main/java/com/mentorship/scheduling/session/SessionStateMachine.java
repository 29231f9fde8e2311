package com.mentorship.scheduling.session;

import com.mentorship.scheduling.entity.SessionStatus;
import com.mentorship.scheduling.exception.InvalidTransitionException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Transition table for mentoring sessions. Every switch here is exhaustive over its enum, so adding
 * a status or an action does not compile until the table has been reviewed.
 * <p>
 * Stateless; persistence and side effects belong to {@link com.mentorship.scheduling.service.SessionService}.
 */
@Component
public class SessionStateMachine {

    /**
     * Validates that {@code actor} may perform {@code action} on a session in {@code from}.
     *
     * @throws InvalidTransitionException if the table has no such edge
     */
    public Transition transition(Actor actor, SessionAction action, SessionStatus from) {
        if (!actionsFrom(from).contains(action) || !action.permittedActors().contains(actor)) {
            throw new InvalidTransitionException(actor, action, from);
        }
        return new Transition(actor, action, from, target(action, from));
    }

    public boolean isPermitted(Actor actor, SessionAction action, SessionStatus from) {
        return actionsFrom(from).contains(action) && action.permittedActors().contains(actor);
    }

    /**
     * Maps a requested target status (the {@code PATCH status} surface) onto the action it stands for,
     * given who is asking and where the session currently is.
     */
    public SessionAction actionFor(Actor actor, SessionStatus from, SessionStatus requested) {
        return switch (requested) {
            case CONFIRMED -> switch (from) {
                case SCHEDULED -> SessionAction.ACCEPT;
                case RESCHEDULED -> SessionAction.ACCEPT_RESCHEDULE;
                default -> throw unreachable(actor, from, requested);
            };
            case CANCELLED -> {
                if (from == SessionStatus.SCHEDULED && actor == Actor.MENTOR) {
                    yield SessionAction.DECLINE;
                }
                if (from == SessionStatus.RESCHEDULED) {
                    yield SessionAction.DECLINE_RESCHEDULE;
                }
                yield SessionAction.CANCEL;
            }
            case IN_PROGRESS -> SessionAction.START;
            case COMPLETED -> SessionAction.COMPLETE;
            case NO_SHOW -> SessionAction.MARK_MISSED;
            case SCHEDULED, RESCHEDULED -> throw unreachable(actor, from, requested);
        };
    }

    Set<SessionAction> actionsFrom(SessionStatus from) {
        return switch (from) {
            case SCHEDULED -> EnumSet.of(SessionAction.ACCEPT, SessionAction.DECLINE, SessionAction.RESCHEDULE,
                    SessionAction.CANCEL, SessionAction.MARK_MISSED);
            case CONFIRMED -> EnumSet.of(SessionAction.CONFIRM_ATTENDANCE, SessionAction.CANCEL,
                    SessionAction.START, SessionAction.COMPLETE, SessionAction.MARK_MISSED);
            case RESCHEDULED -> EnumSet.of(SessionAction.ACCEPT_RESCHEDULE, SessionAction.DECLINE_RESCHEDULE);
            case IN_PROGRESS -> EnumSet.of(SessionAction.COMPLETE);
            // idempotent re-run of the missed sweep
            case NO_SHOW -> EnumSet.of(SessionAction.MARK_MISSED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(SessionAction.class);
        };
    }

    private static SessionStatus target(SessionAction action, SessionStatus from) {
        return switch (action) {
            case ACCEPT, ACCEPT_RESCHEDULE -> SessionStatus.CONFIRMED;
            case DECLINE, DECLINE_RESCHEDULE, CANCEL -> SessionStatus.CANCELLED;
            case RESCHEDULE -> SessionStatus.RESCHEDULED;
            case CONFIRM_ATTENDANCE -> from;
            case START -> SessionStatus.IN_PROGRESS;
            case COMPLETE -> SessionStatus.COMPLETED;
            case MARK_MISSED -> SessionStatus.NO_SHOW;
        };
    }

    private static InvalidTransitionException unreachable(Actor actor, SessionStatus from, SessionStatus requested) {
        return new InvalidTransitionException(actor.name().toLowerCase() + " cannot move a "
                + from.wireValue() + " session to " + requested.wireValue());
    }
}
