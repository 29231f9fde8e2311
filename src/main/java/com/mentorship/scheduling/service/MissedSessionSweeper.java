package com.mentorship.scheduling.service;

import com.mentorship.scheduling.entity.Session;
import com.mentorship.scheduling.entity.SessionStatus;
import com.mentorship.scheduling.repository.SessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

/**
 * Time-driven pass over sessions whose end plus grace has passed. Unattended sessions become no_show,
 * sessions still in progress are completed. Each session is handled in its own transaction.
 */
@Component
public class MissedSessionSweeper {

    private static final Logger log = LoggerFactory.getLogger(MissedSessionSweeper.class);

    private final SessionRepository sessionRepository;
    private final SessionService sessionService;
    private final Clock clock;
    private final Duration grace;

    public MissedSessionSweeper(SessionRepository sessionRepository,
                                SessionService sessionService,
                                Clock clock,
                                @Value("${scheduling.missed-grace-minutes:120}") long graceMinutes) {
        this.sessionRepository = sessionRepository;
        this.sessionService = sessionService;
        this.clock = clock;
        this.grace = Duration.ofMinutes(graceMinutes);
    }

    public record SweepResult(int markedMissed, int completed, int failed) {
    }

    @Scheduled(fixedDelayString = "${scheduling.missed-sweep-interval-ms:300000}",
            initialDelayString = "${scheduling.missed-sweep-initial-delay-ms:60000}")
    public void scheduledSweep() {
        SweepResult result = sweep();
        if (result.markedMissed() + result.completed() + result.failed() > 0) {
            log.info("Missed-session sweep: {} no_show, {} completed, {} failed",
                    result.markedMissed(), result.completed(), result.failed());
        }
    }

    public SweepResult sweep() {
        Instant now = clock.instant();
        int missed = 0;
        int completed = 0;
        int failed = 0;

        // scheduledAt before now - grace is a superset; the per-session end check narrows it
        List<Session> candidates = sessionRepository.findByStatusInAndScheduledAtBeforeOrderByScheduledAtAsc(
                EnumSet.of(SessionStatus.SCHEDULED, SessionStatus.CONFIRMED, SessionStatus.IN_PROGRESS),
                now.minus(grace));
        for (Session session : candidates) {
            if (!session.getEndsAt().plus(grace).isBefore(now)) {
                continue;
            }
            try {
                if (session.getStatus() == SessionStatus.IN_PROGRESS) {
                    sessionService.completeElapsed(session.getId());
                    completed++;
                } else {
                    sessionService.markMissed(session.getId());
                    missed++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Sweep failed for session {}: {}", session.getId(), e.getMessage(), e);
            }
        }
        return new SweepResult(missed, completed, failed);
    }
}
