package com.mentorship.scheduling.service;

import com.mentorship.scheduling.entity.AvailabilityRule;
import com.mentorship.scheduling.entity.Session;
import com.mentorship.scheduling.entity.SessionStatus;
import com.mentorship.scheduling.entity.SlotClaim;
import com.mentorship.scheduling.exception.ClaimTimeoutException;
import com.mentorship.scheduling.exception.NotFoundException;
import com.mentorship.scheduling.exception.SlotConflictException;
import com.mentorship.scheduling.exception.SlotUnavailableException;
import com.mentorship.scheduling.exception.ValidationException;
import com.mentorship.scheduling.port.NotificationKind;
import com.mentorship.scheduling.port.UserDirectory;
import com.mentorship.scheduling.port.UserProfile;
import com.mentorship.scheduling.repository.SessionRepository;
import com.mentorship.scheduling.repository.SlotClaimRepository;
import com.mentorship.scheduling.session.SessionEvents;
import com.mentorship.scheduling.utils.TimeFormats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Concurrency-safe booking. Availability is re-derived inside the booking transaction, but the
 * unique (mentor, instant) constraint on {@link SlotClaim} is what decides a race: the pre-check
 * only saves a round trip for the common case.
 */
@Service
public class BookingValidator {

    private static final Logger log = LoggerFactory.getLogger(BookingValidator.class);

    private final AvailabilityService availabilityService;
    private final SlotService slotService;
    private final SlotGenerator slotGenerator;
    private final SessionRepository sessionRepository;
    private final SlotClaimRepository slotClaimRepository;
    private final UserDirectory userDirectory;
    private final ApplicationEventPublisher events;
    private final Clock clock;
    private final Set<Integer> allowedDurations;

    public BookingValidator(AvailabilityService availabilityService,
                            SlotService slotService,
                            SlotGenerator slotGenerator,
                            SessionRepository sessionRepository,
                            SlotClaimRepository slotClaimRepository,
                            UserDirectory userDirectory,
                            ApplicationEventPublisher events,
                            Clock clock,
                            @Value("${scheduling.allowed-session-durations:30,60,90,120}") List<Integer> allowedDurations) {
        this.availabilityService = availabilityService;
        this.slotService = slotService;
        this.slotGenerator = slotGenerator;
        this.sessionRepository = sessionRepository;
        this.slotClaimRepository = slotClaimRepository;
        this.userDirectory = userDirectory;
        this.events = events;
        this.clock = clock;
        this.allowedDurations = new TreeSet<>(allowedDurations);
    }

    /**
     * Books {@code time} on {@code date} (wall clock in the mentor's availability zone) for the mentee.
     *
     * @param duration minutes, or null for the slot width of the day's rule
     * @return the new session in {@code scheduled} status
     * @throws SlotUnavailableException outside hours, inside a break or in the past
     * @throws SlotConflictException    another session holds or overlaps the time
     * @throws ClaimTimeoutException    the claim could not be written within the lock timeout; safe to retry
     */
    @Transactional
    public Session bookSlot(Long mentorId, Long menteeId, LocalDate date, LocalTime time, Integer duration) {
        if (mentorId == null || menteeId == null || date == null || time == null) {
            throw new ValidationException("mentorId, menteeId, date and time are required");
        }
        if (duration != null && !allowedDurations.contains(duration)) {
            throw new ValidationException("duration must be one of " + allowedDurations + " minutes");
        }
        if (mentorId.equals(menteeId)) {
            throw new ValidationException("A mentor cannot book a session with themselves");
        }
        availabilityService.requireMentor(mentorId);
        userDirectory.getUser(menteeId)
                .filter(UserProfile::isMentee)
                .orElseThrow(() -> new NotFoundException("Mentee " + menteeId + " not found"));

        AvailabilityRule rule = resolveOpenRule(mentorId, date);
        int minutes = duration != null ? duration : rule.getSlotDurationMinutes();
        Instant scheduledAt = checkAvailable(rule, mentorId, date, time, minutes, null);

        Session session = sessionRepository.save(Session.builder()
                .mentorId(mentorId)
                .menteeId(menteeId)
                .scheduledAt(scheduledAt)
                .requestedScheduledAt(scheduledAt)
                .timezone(rule.getTimezone())
                .durationMinutes(minutes)
                .status(SessionStatus.SCHEDULED)
                .build());
        claim(session.getId(), mentorId, scheduledAt, minutes, rule.getSlotDurationMinutes());

        events.publishEvent(SessionEvents.of(session, NotificationKind.SESSION_REQUESTED, mentorId));
        log.info("Booked session {}: mentor={} mentee={} at {} {} ({} min)",
                session.getId(), mentorId, menteeId, date, TimeFormats.format(time), minutes);
        return session;
    }

    /**
     * Books from the API form: {@code scheduledAt} is a wall-clock date-time in the mentor's availability zone.
     */
    @Transactional
    public Session bookSlot(Long mentorId, Long menteeId, String scheduledAt, Integer duration) {
        LocalDateTime wallClock = TimeFormats.parseWallClock(scheduledAt, "scheduledAt");
        return bookSlot(mentorId, menteeId, wallClock.toLocalDate(), wallClock.toLocalTime(), duration);
    }

    /**
     * Moves the claim of an existing session to a new time. Runs inside the caller's transaction so the
     * claim swap and the status change commit or roll back together.
     *
     * @return the new start instant
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ClaimedSlot reclaim(Session session, LocalDate date, LocalTime time) {
        AvailabilityRule rule = resolveOpenRule(session.getMentorId(), date);
        Instant scheduledAt = checkAvailable(rule, session.getMentorId(), date, time, session.getDurationMinutes(), session.getId());
        slotClaimRepository.deleteBySessionId(session.getId());
        claim(session.getId(), session.getMentorId(), scheduledAt, session.getDurationMinutes(),
                rule.getSlotDurationMinutes());
        return new ClaimedSlot(scheduledAt, rule.getTimezone());
    }

    public record ClaimedSlot(Instant scheduledAt, String timezone) {
    }

    private AvailabilityRule resolveOpenRule(Long mentorId, LocalDate date) {
        return availabilityService.resolveRule(mentorId, date)
                .filter(r -> r.getStatus() == AvailabilityRule.Status.AVAILABLE)
                .orElseThrow(() -> new SlotUnavailableException("Mentor has no availability on " + date));
    }

    /**
     * Re-derives availability of [time, time + minutes) on the day's slot grid.
     */
    private Instant checkAvailable(AvailabilityRule rule, Long mentorId, LocalDate date, LocalTime time,
                                   int minutes, Long excludeSessionId) {
        ZoneId zone = ZoneId.of(rule.getTimezone());
        Instant now = clock.instant();
        String label = date + " " + TimeFormats.format(time);

        SlotGenerator.CandidateSlot slot = slotGenerator.candidateAt(rule, date, time, List.of(), now)
                .orElseThrow(() -> new SlotUnavailableException(label + " is not a slot within the mentor's hours"));
        if (slot.past()) {
            throw new SlotUnavailableException(label + " is in the past");
        }
        int startMinute = SlotGenerator.minuteOfDay(time);
        int endMinute = startMinute + minutes;
        if (!slotGenerator.withinWindow(rule, startMinute, endMinute)) {
            throw new SlotUnavailableException("A " + minutes + " minute session at " + label + " runs past the mentor's hours");
        }
        if (slotGenerator.overlapsBreak(rule, startMinute, endMinute)) {
            throw new SlotUnavailableException(label + " falls in a break");
        }

        Instant startsAt = SlotGenerator.toInstant(date, time, zone);
        Instant endsAt = startsAt.plusSeconds(minutes * 60L);
        List<Session> occupying = slotService.occupyingSessions(mentorId, date, zone);
        if (slotGenerator.overlapsAny(occupying, startsAt, endsAt, excludeSessionId)) {
            throw new SlotConflictException(label + " is already booked");
        }
        return startsAt;
    }

    /**
     * Claims every slot-grid instant in [scheduledAt, scheduledAt + minutes). Any other session of the
     * mentor that overlaps this one starts on the same grid, so it holds at least one of these instants.
     */
    private void claim(Long sessionId, Long mentorId, Instant scheduledAt, int minutes, int slotWidth) {
        Instant claimedAt = clock.instant();
        List<SlotClaim> claims = new ArrayList<>();
        for (int offset = 0; offset < minutes; offset += slotWidth) {
            claims.add(SlotClaim.builder()
                    .sessionId(sessionId)
                    .mentorId(mentorId)
                    .scheduledAt(scheduledAt.plusSeconds(offset * 60L))
                    .claimedAt(claimedAt)
                    .build());
        }
        try {
            slotClaimRepository.saveAllAndFlush(claims);
        } catch (DataIntegrityViolationException e) {
            log.info("Lost slot race for mentor {} at {}", mentorId, scheduledAt);
            throw new SlotConflictException("The slot at " + scheduledAt + " was just taken", e);
        } catch (PessimisticLockingFailureException | QueryTimeoutException e) {
            log.warn("Timed out claiming slot for mentor {} at {}", mentorId, scheduledAt);
            throw new ClaimTimeoutException("Could not claim the slot in time, please retry", e);
        } catch (ConcurrencyFailureException e) {
            log.info("Concurrent claim for mentor {} at {}", mentorId, scheduledAt);
            throw new SlotConflictException("The slot at " + scheduledAt + " was just taken", e);
        }
    }
}
