package com.mentorship.scheduling.service;

import com.mentorship.scheduling.entity.Session;
import com.mentorship.scheduling.entity.SessionStatus;
import com.mentorship.scheduling.port.EmailPort;
import com.mentorship.scheduling.port.NotificationKind;
import com.mentorship.scheduling.port.NotificationPort;
import com.mentorship.scheduling.repository.SessionRepository;
import com.mentorship.scheduling.repository.SlotClaimRepository;
import com.mentorship.scheduling.support.MutableClock;
import com.mentorship.scheduling.support.SchedulingFixtures;
import com.mentorship.scheduling.support.TestClockConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.time.LocalTime;

import static com.mentorship.scheduling.support.SchedulingFixtures.MONDAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@SpringBootTest
@Import({TestClockConfig.class, SchedulingFixtures.class})
class MissedSessionSweeperTest {

    @Autowired MissedSessionSweeper sweeper;
    @Autowired BookingValidator bookingValidator;
    @Autowired SessionService sessionService;
    @Autowired SessionRepository sessionRepository;
    @Autowired SlotClaimRepository slotClaimRepository;
    @Autowired SchedulingFixtures fixtures;
    @Autowired MutableClock clock;

    @MockBean NotificationPort notificationPort;
    @MockBean EmailPort emailPort;

    Long mentorId;
    Long menteeId;

    @BeforeEach
    void setUp() {
        clock.set(TestClockConfig.START);
        mentorId = fixtures.mentor("Mentor One").getId();
        menteeId = fixtures.mentee("Mentee One").getId();
        fixtures.mondayHours(mentorId, "UTC");
    }

    @AfterEach
    void tearDown() {
        fixtures.clear();
    }

    @Test
    void confirmedSessionPastGraceIsMarkedMissedOnce() {
        Session session = bookingValidator.bookSlot(mentorId, menteeId, MONDAY, LocalTime.of(9, 0), null);
        sessionService.accept(session.getId(), mentorId);

        // 09:00 + 30 min + 120 min grace
        clock.set(Instant.parse("2030-01-07T11:31:00Z"));
        MissedSessionSweeper.SweepResult first = sweeper.sweep();
        MissedSessionSweeper.SweepResult second = sweeper.sweep();

        assertThat(first.markedMissed()).isEqualTo(1);
        assertThat(second.markedMissed()).isZero();
        Session swept = sessionRepository.findById(session.getId()).orElseThrow();
        assertThat(swept.getStatus()).isEqualTo(SessionStatus.NO_SHOW);
        assertThat(slotClaimRepository.findBySessionIdOrderByScheduledAt(session.getId())).isEmpty();

        Session again = sessionService.markMissed(session.getId());
        assertThat(again.getStatus()).isEqualTo(SessionStatus.NO_SHOW);
        assertThat(again.getVersion()).isEqualTo(swept.getVersion());

        verify(notificationPort, after(500).times(1)).notify(eq(mentorId), eq(NotificationKind.SESSION_MISSED), anyMap());
        verify(notificationPort, timeout(2000).times(1)).notify(eq(menteeId), eq(NotificationKind.SESSION_MISSED), anyMap());
    }

    @Test
    void sessionWithinGraceIsLeftAlone() {
        Session session = bookingValidator.bookSlot(mentorId, menteeId, MONDAY, LocalTime.of(9, 0), null);

        clock.set(Instant.parse("2030-01-07T11:29:00Z"));
        MissedSessionSweeper.SweepResult result = sweeper.sweep();

        assertThat(result.markedMissed()).isZero();
        assertThat(sessionRepository.findById(session.getId()).orElseThrow().getStatus()).isEqualTo(SessionStatus.SCHEDULED);
    }

    @Test
    void longerSessionUsesItsOwnEnd() {
        Session session = bookingValidator.bookSlot(mentorId, menteeId, MONDAY, LocalTime.of(9, 0), 120);

        // past 09:30 + grace but not 11:00 + grace
        clock.set(Instant.parse("2030-01-07T12:00:00Z"));
        assertThat(sweeper.sweep().markedMissed()).isZero();

        clock.set(Instant.parse("2030-01-07T13:01:00Z"));
        assertThat(sweeper.sweep().markedMissed()).isEqualTo(1);
        assertThat(sessionRepository.findById(session.getId()).orElseThrow().getStatus()).isEqualTo(SessionStatus.NO_SHOW);
    }

    @Test
    void inProgressSessionIsCompleted() {
        Session session = bookingValidator.bookSlot(mentorId, menteeId, MONDAY, LocalTime.of(9, 0), null);
        sessionService.accept(session.getId(), mentorId);
        clock.set(Instant.parse("2030-01-07T09:00:00Z"));
        sessionService.start(session.getId(), menteeId);

        clock.set(Instant.parse("2030-01-07T12:00:00Z"));
        MissedSessionSweeper.SweepResult result = sweeper.sweep();

        assertThat(result.completed()).isEqualTo(1);
        assertThat(result.markedMissed()).isZero();
        Session done = sessionRepository.findById(session.getId()).orElseThrow();
        assertThat(done.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(done.getEndedAt()).isEqualTo(Instant.parse("2030-01-07T12:00:00Z"));
    }

    @Test
    void cancelledSessionsAreNotSwept() {
        Session session = bookingValidator.bookSlot(mentorId, menteeId, MONDAY, LocalTime.of(9, 0), null);
        sessionService.cancel(session.getId(), menteeId, null);

        clock.set(Instant.parse("2030-01-08T00:00:00Z"));

        assertThat(sweeper.sweep()).isEqualTo(new MissedSessionSweeper.SweepResult(0, 0, 0));
        assertThat(sessionRepository.findById(session.getId()).orElseThrow().getStatus()).isEqualTo(SessionStatus.CANCELLED);
    }
}
