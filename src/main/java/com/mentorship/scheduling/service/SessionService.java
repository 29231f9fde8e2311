package com.mentorship.scheduling.service;

import com.mentorship.scheduling.dto.SessionPageResponse;
import com.mentorship.scheduling.dto.SessionResponse;
import com.mentorship.scheduling.entity.Session;
import com.mentorship.scheduling.entity.SessionStatus;
import com.mentorship.scheduling.exception.InvalidTransitionException;
import com.mentorship.scheduling.exception.NotFoundException;
import com.mentorship.scheduling.exception.ValidationException;
import com.mentorship.scheduling.port.NotificationKind;
import com.mentorship.scheduling.repository.SessionRepository;
import com.mentorship.scheduling.repository.SlotClaimRepository;
import com.mentorship.scheduling.session.Actor;
import com.mentorship.scheduling.session.SessionAction;
import com.mentorship.scheduling.session.SessionEvents;
import com.mentorship.scheduling.session.SessionStateMachine;
import com.mentorship.scheduling.session.Transition;
import com.mentorship.scheduling.utils.TimeFormats;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Session lifecycle. Every transition locks the session row, validates the move against
 * {@link SessionStateMachine}, applies its side effects and publishes a {@link com.mentorship.scheduling.session.SessionEvent}
 * that is delivered once the transaction commits.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final SessionRepository sessionRepository;
    private final SlotClaimRepository slotClaimRepository;
    private final SessionStateMachine stateMachine;
    private final BookingValidator bookingValidator;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final Duration earlyJoin;

    public SessionService(SessionRepository sessionRepository,
                          SlotClaimRepository slotClaimRepository,
                          SessionStateMachine stateMachine,
                          BookingValidator bookingValidator,
                          ApplicationEventPublisher events,
                          Clock clock,
                          @Value("${scheduling.early-join-minutes:5}") long earlyJoinMinutes) {
        this.sessionRepository = sessionRepository;
        this.slotClaimRepository = slotClaimRepository;
        this.stateMachine = stateMachine;
        this.bookingValidator = bookingValidator;
        this.events = events;
        this.clock = clock;
        this.earlyJoin = Duration.ofMinutes(earlyJoinMinutes);
    }

    /** Non-participants get NotFound so the session's existence is not disclosed. */
    @Transactional(readOnly = true)
    public Session getSession(Long sessionId, Long userId) {
        return sessionRepository.findById(sessionId)
                .filter(s -> s.involves(userId))
                .orElseThrow(() -> new NotFoundException("Session " + sessionId + " not found"));
    }

    /**
     * @param role     "mentor", "mentee" or blank for both sides
     * @param upcoming true for sessions starting from now on, false for those already started, null for all
     */
    @Transactional(readOnly = true)
    public SessionPageResponse listSessions(Long userId, String role, String status, Boolean upcoming,
                                            Integer limit, Integer offset) {
        int size = limit != null ? limit : DEFAULT_LIMIT;
        int from = offset != null ? offset : 0;
        if (size < 1 || size > MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (from < 0) {
            throw new ValidationException("offset must not be negative");
        }

        Specification<Session> spec = participant(userId, role);
        if (StringUtils.isNotBlank(status)) {
            SessionStatus wanted = parseStatus(status);
            spec = spec.and((root, query, cb) -> cb.equal(root.get("status"), wanted));
        }
        if (upcoming != null) {
            Instant now = clock.instant();
            spec = spec.and((root, query, cb) -> upcoming
                    ? cb.greaterThanOrEqualTo(root.<Instant>get("scheduledAt"), now)
                    : cb.lessThan(root.<Instant>get("scheduledAt"), now));
        }

        // offsets are rounded down to a page boundary
        PageRequest page = PageRequest.of(from / size, size, Sort.by(Sort.Direction.ASC, "scheduledAt", "id"));
        Page<Session> result = sessionRepository.findAll(spec, page);
        return new SessionPageResponse(
                result.getContent().stream().map(SessionResponse::from).toList(),
                result.getTotalElements(),
                size,
                (int) page.getOffset(),
                result.getTotalPages());
    }

    /**
     * Applies the action that the requested target status stands for, given the caller's side and the
     * session's current status.
     */
    @Transactional
    public Session updateStatus(Long sessionId, Long userId, String status, String reason) {
        SessionStatus requested = parseStatus(status);
        Session session = lockForParticipant(sessionId, userId);
        Actor actor = actorOf(session, userId);
        SessionAction action = stateMachine.actionFor(actor, session.getStatus(), requested);
        return apply(session, actor, action, reason);
    }

    @Transactional
    public Session accept(Long sessionId, Long userId) {
        return act(sessionId, userId, SessionAction.ACCEPT, null);
    }

    @Transactional
    public Session decline(Long sessionId, Long userId, String reason) {
        return act(sessionId, userId, SessionAction.DECLINE, reason);
    }

    @Transactional
    public Session acceptReschedule(Long sessionId, Long userId) {
        return act(sessionId, userId, SessionAction.ACCEPT_RESCHEDULE, null);
    }

    @Transactional
    public Session cancel(Long sessionId, Long userId, String reason) {
        return act(sessionId, userId, SessionAction.CANCEL, reason);
    }

    @Transactional
    public Session confirmAttendance(Long sessionId, Long userId) {
        return act(sessionId, userId, SessionAction.CONFIRM_ATTENDANCE, null);
    }

    @Transactional
    public Session start(Long sessionId, Long userId) {
        return act(sessionId, userId, SessionAction.START, null);
    }

    @Transactional
    public Session complete(Long sessionId, Long userId) {
        return act(sessionId, userId, SessionAction.COMPLETE, null);
    }

    /**
     * Mentor proposes a new time. The new slot is claimed and the old one released in this transaction,
     * so a conflicting booking leaves the session untouched.
     *
     * @param newScheduledAt wall clock in the mentor's availability zone for the new date
     */
    @Transactional
    public Session reschedule(Long sessionId, Long userId, String newScheduledAt, String reason, String message) {
        LocalDateTime wallClock = TimeFormats.parseWallClock(newScheduledAt, "newScheduledAt");
        Session session = lockForParticipant(sessionId, userId);
        Actor actor = actorOf(session, userId);
        Transition transition = stateMachine.transition(actor, SessionAction.RESCHEDULE, session.getStatus());

        Instant previous = session.getScheduledAt();
        BookingValidator.ClaimedSlot slot = bookingValidator.reclaim(session, wallClock.toLocalDate(), wallClock.toLocalTime());

        session.setPreviousScheduledAt(previous);
        session.setScheduledAt(slot.scheduledAt());
        session.setTimezone(slot.timezone());
        session.setRescheduleRequestedAt(clock.instant());
        session.setRescheduleReason(StringUtils.trimToNull(reason));
        session.setRescheduleMessage(StringUtils.trimToNull(message));
        session.setStatus(transition.to());
        Session saved = sessionRepository.save(session);

        events.publishEvent(SessionEvents.of(saved, NotificationKind.SESSION_RESCHEDULED, saved.getMenteeId()));
        log.info("Session {} rescheduled from {} to {}", saved.getId(), previous, saved.getScheduledAt());
        return saved;
    }

    /** Idempotent: a session already marked no_show is returned unchanged. */
    @Transactional
    public Session markMissed(Long sessionId) {
        Session session = lock(sessionId);
        return apply(session, Actor.SYSTEM, SessionAction.MARK_MISSED, null);
    }

    /** Closes an in-progress session whose time has run out. */
    @Transactional
    public Session completeElapsed(Long sessionId) {
        Session session = lock(sessionId);
        return apply(session, Actor.SYSTEM, SessionAction.COMPLETE, null);
    }

    private Session act(Long sessionId, Long userId, SessionAction action, String reason) {
        Session session = lockForParticipant(sessionId, userId);
        return apply(session, actorOf(session, userId), action, reason);
    }

    private Session apply(Session session, Actor actor, SessionAction action, String reason) {
        Transition transition = stateMachine.transition(actor, action, session.getStatus());
        if (transition.isNoOp()) {
            log.debug("Session {} already {}, nothing to do", session.getId(), session.getStatus().wireValue());
            return session;
        }
        Instant now = clock.instant();
        NotificationKind kind = null;
        Long[] recipients = new Long[0];

        switch (action) {
            case ACCEPT -> {
                kind = NotificationKind.SESSION_CONFIRMED;
                recipients = new Long[]{session.getMenteeId()};
            }
            case ACCEPT_RESCHEDULE -> {
                kind = NotificationKind.SESSION_CONFIRMED;
                recipients = new Long[]{session.getMentorId()};
            }
            case DECLINE, DECLINE_RESCHEDULE -> {
                markCancelled(session, actor, reason, now);
                kind = NotificationKind.SESSION_DECLINED;
                recipients = new Long[]{otherParty(session, actor)};
            }
            case CANCEL -> {
                markCancelled(session, actor, reason, now);
                kind = NotificationKind.SESSION_CANCELLED;
                recipients = new Long[]{otherParty(session, actor)};
            }
            case CONFIRM_ATTENDANCE -> {
                if (actor == Actor.MENTOR) {
                    session.setMentorConfirmed(true);
                } else {
                    session.setMenteeConfirmed(true);
                }
            }
            case START -> {
                Instant opensAt = session.getScheduledAt().minus(earlyJoin);
                if (now.isBefore(opensAt)) {
                    throw new InvalidTransitionException("Session " + session.getId() + " cannot be started before " + opensAt);
                }
                session.setStartedAt(now);
            }
            case COMPLETE -> session.setEndedAt(now);
            case MARK_MISSED -> {
                kind = NotificationKind.SESSION_MISSED;
                recipients = new Long[]{session.getMentorId(), session.getMenteeId()};
            }
            case RESCHEDULE -> throw new IllegalStateException("Reschedule needs a new slot claim");
        }

        session.setStatus(transition.to());
        if (transition.releasesSlot()) {
            int released = slotClaimRepository.deleteBySessionId(session.getId());
            log.debug("Released {} slot claim(s) of session {}", released, session.getId());
        }
        Session saved = sessionRepository.save(session);
        if (kind != null) {
            events.publishEvent(SessionEvents.of(saved, kind, recipients));
        }
        log.info("Session {} {} by {}: {} -> {}", saved.getId(), action.name().toLowerCase(),
                actor.name().toLowerCase(), transition.from().wireValue(), transition.to().wireValue());
        return saved;
    }

    private static void markCancelled(Session session, Actor actor, String reason, Instant now) {
        session.setCancellationReason(StringUtils.trimToNull(reason));
        session.setCancelledBy(actor);
        session.setCancelledAt(now);
    }

    private static Long otherParty(Session session, Actor actor) {
        return actor == Actor.MENTOR ? session.getMenteeId() : session.getMentorId();
    }

    private Session lock(Long sessionId) {
        return sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new NotFoundException("Session " + sessionId + " not found"));
    }

    private Session lockForParticipant(Long sessionId, Long userId) {
        Session session = lock(sessionId);
        if (!session.involves(userId)) {
            throw new InvalidTransitionException("User " + userId + " is not a party to session " + sessionId);
        }
        return session;
    }

    private static Actor actorOf(Session session, Long userId) {
        return userId.equals(session.getMentorId()) ? Actor.MENTOR : Actor.MENTEE;
    }

    private static Specification<Session> participant(Long userId, String role) {
        if ("mentor".equalsIgnoreCase(StringUtils.trimToEmpty(role))) {
            return (root, query, cb) -> cb.equal(root.get("mentorId"), userId);
        }
        if ("mentee".equalsIgnoreCase(StringUtils.trimToEmpty(role))) {
            return (root, query, cb) -> cb.equal(root.get("menteeId"), userId);
        }
        if (StringUtils.isNotBlank(role)) {
            throw new ValidationException("role must be mentor or mentee");
        }
        return (root, query, cb) -> cb.or(
                cb.equal(root.get("mentorId"), userId),
                cb.equal(root.get("menteeId"), userId));
    }

    private static SessionStatus parseStatus(String status) {
        try {
            return SessionStatus.fromWire(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown session status '" + status + "'");
        }
    }
}
