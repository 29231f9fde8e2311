package com.mentorship.scheduling.service;

import com.mentorship.scheduling.dto.Slot;
import com.mentorship.scheduling.entity.AvailabilityRule;
import com.mentorship.scheduling.entity.Session;
import com.mentorship.scheduling.entity.SessionStatus;
import com.mentorship.scheduling.repository.SessionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Slot listing for a mentor and date. Recomputed from rules and sessions on every call; nothing is cached.
 */
@Service
public class SlotService {

    static final Set<SessionStatus> OCCUPYING = EnumSet.copyOf(Arrays.stream(SessionStatus.values())
            .filter(SessionStatus::isSlotOccupying)
            .toList());

    /** Look-back for sessions that start the day before and run past midnight. */
    private static final Duration LOOK_BACK = Duration.ofDays(1);

    private final AvailabilityService availabilityService;
    private final SessionRepository sessionRepository;
    private final SlotGenerator slotGenerator;
    private final Clock clock;

    public SlotService(AvailabilityService availabilityService, SessionRepository sessionRepository,
                       SlotGenerator slotGenerator, Clock clock) {
        this.availabilityService = availabilityService;
        this.sessionRepository = sessionRepository;
        this.slotGenerator = slotGenerator;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<Slot> generateSlots(Long mentorId, LocalDate date) {
        availabilityService.requireMentor(mentorId);
        Optional<AvailabilityRule> rule = availabilityService.resolveRule(mentorId, date);
        if (rule.isEmpty() || rule.get().getStatus() == AvailabilityRule.Status.UNAVAILABLE) {
            return List.of();
        }
        List<Session> occupying = occupyingSessions(mentorId, date, ZoneId.of(rule.get().getTimezone()));
        return slotGenerator.generate(rule.get(), date, occupying, clock.instant());
    }

    /**
     * Slot-occupying sessions of the mentor that may overlap {@code date} in {@code zone}.
     */
    @Transactional(readOnly = true)
    public List<Session> occupyingSessions(Long mentorId, LocalDate date, ZoneId zone) {
        Instant dayStart = date.atStartOfDay(zone).toInstant();
        Instant dayEnd = date.plusDays(1).atStartOfDay(zone).toInstant();
        return sessionRepository.findByMentorInWindow(mentorId, OCCUPYING, dayStart.minus(LOOK_BACK), dayEnd);
    }
}
