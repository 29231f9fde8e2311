package com.mentorship.scheduling.service;

import com.mentorship.scheduling.dto.SessionPageResponse;
import com.mentorship.scheduling.dto.SessionResponse;
import com.mentorship.scheduling.entity.Session;
import com.mentorship.scheduling.entity.SessionStatus;
import com.mentorship.scheduling.entity.SlotClaim;
import com.mentorship.scheduling.exception.InvalidTransitionException;
import com.mentorship.scheduling.exception.NotFoundException;
import com.mentorship.scheduling.exception.SlotConflictException;
import com.mentorship.scheduling.exception.ValidationException;
import com.mentorship.scheduling.port.EmailPort;
import com.mentorship.scheduling.port.NotificationKind;
import com.mentorship.scheduling.port.NotificationPort;
import com.mentorship.scheduling.repository.SessionRepository;
import com.mentorship.scheduling.repository.SlotClaimRepository;
import com.mentorship.scheduling.session.Actor;
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
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.mentorship.scheduling.support.SchedulingFixtures.MONDAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@SpringBootTest
@Import({TestClockConfig.class, SchedulingFixtures.class})
class SessionServiceIntegrationTest {

    @Autowired BookingValidator bookingValidator;
    @Autowired SessionService sessionService;
    @Autowired SlotService slotService;
    @Autowired SessionRepository sessionRepository;
    @Autowired SlotClaimRepository slotClaimRepository;
    @Autowired SchedulingFixtures fixtures;
    @Autowired MutableClock clock;

    @MockBean NotificationPort notificationPort;
    @MockBean EmailPort emailPort;

    Long mentorId;
    Long menteeId;
    Long strangerId;

    @BeforeEach
    void setUp() {
        clock.set(TestClockConfig.START);
        mentorId = fixtures.mentor("Mentor One").getId();
        menteeId = fixtures.mentee("Mentee One").getId();
        strangerId = fixtures.mentee("Someone Else").getId();
        fixtures.mondayHours(mentorId, "UTC");
    }

    @AfterEach
    void tearDown() {
        fixtures.clear();
    }

    @Test
    void rescheduleThenMenteeAccepts() {
        Session booked = book(LocalTime.of(9, 0));

        Session moved = sessionService.reschedule(booked.getId(), mentorId, "2030-01-07T14:00", "Clash", "Afternoon works better");

        assertThat(moved.getStatus()).isEqualTo(SessionStatus.RESCHEDULED);
        assertThat(moved.getPreviousScheduledAt()).isEqualTo(Instant.parse("2030-01-07T09:00:00Z"));
        assertThat(moved.getScheduledAt()).isEqualTo(Instant.parse("2030-01-07T14:00:00Z"));
        assertThat(moved.getRequestedScheduledAt()).isEqualTo(Instant.parse("2030-01-07T09:00:00Z"));
        assertThat(moved.getRescheduleReason()).isEqualTo("Clash");
        assertThat(moved.getRescheduleMessage()).isEqualTo("Afternoon works better");
        assertThat(slotClaimRepository.findBySessionIdOrderByScheduledAt(booked.getId()))
                .extracting(SlotClaim::getScheduledAt)
                .containsExactly(moved.getScheduledAt());
        verify(notificationPort, timeout(2000)).notify(eq(menteeId), eq(NotificationKind.SESSION_RESCHEDULED), anyMap());

        // the old time is free again
        bookingValidator.bookSlot(mentorId, strangerId, MONDAY, LocalTime.of(9, 0), null);

        Session accepted = sessionService.acceptReschedule(booked.getId(), menteeId);
        assertThat(accepted.getStatus()).isEqualTo(SessionStatus.CONFIRMED);
        verify(notificationPort, timeout(2000)).notify(eq(mentorId), eq(NotificationKind.SESSION_CONFIRMED), anyMap());
    }

    @Test
    void rescheduleThenMenteeDeclinesReleasesTheSlot() {
        Session booked = book(LocalTime.of(9, 0));
        sessionService.reschedule(booked.getId(), mentorId, "2030-01-07T10:00", null, null);

        Session declined = sessionService.updateStatus(booked.getId(), menteeId, "cancelled", "Cannot make it");

        assertThat(declined.getStatus()).isEqualTo(SessionStatus.CANCELLED);
        assertThat(declined.getCancelledBy()).isEqualTo(Actor.MENTEE);
        assertThat(declined.getCancellationReason()).isEqualTo("Cannot make it");
        assertThat(slotClaimRepository.findBySessionIdOrderByScheduledAt(booked.getId())).isEmpty();
        assertThat(slotService.generateSlots(mentorId, MONDAY))
                .filteredOn(s -> s.time().equals("10:00")).singleElement()
                .satisfies(s -> assertThat(s.available()).isTrue());
        verify(notificationPort, timeout(2000)).notify(eq(mentorId), eq(NotificationKind.SESSION_DECLINED), anyMap());
    }

    @Test
    void confirmedSessionCannotBeRescheduled() {
        Session booked = book(LocalTime.of(9, 0));
        sessionService.accept(booked.getId(), mentorId);

        assertThatThrownBy(() -> sessionService.reschedule(booked.getId(), mentorId, "2030-01-07T14:00", null, null))
                .isInstanceOf(InvalidTransitionException.class);

        Session unchanged = sessionRepository.findById(booked.getId()).orElseThrow();
        assertThat(unchanged.getStatus()).isEqualTo(SessionStatus.CONFIRMED);
        assertThat(unchanged.getScheduledAt()).isEqualTo(Instant.parse("2030-01-07T09:00:00Z"));
    }

    @Test
    void rescheduleOntoBookedTimeLeavesSessionUntouched() {
        Session first = book(LocalTime.of(9, 0));
        bookingValidator.bookSlot(mentorId, strangerId, MONDAY, LocalTime.of(10, 0), null);

        assertThatThrownBy(() -> sessionService.reschedule(first.getId(), mentorId, "2030-01-07T10:00", null, null))
                .isInstanceOf(SlotConflictException.class);

        Session unchanged = sessionRepository.findById(first.getId()).orElseThrow();
        assertThat(unchanged.getStatus()).isEqualTo(SessionStatus.SCHEDULED);
        assertThat(slotClaimRepository.findBySessionIdOrderByScheduledAt(first.getId()))
                .extracting(SlotClaim::getScheduledAt)
                .containsExactly(Instant.parse("2030-01-07T09:00:00Z"));
    }

    @Test
    void rescheduleRacingAFreshBookingHasExactlyOneWinner() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 10; round++) {
                Long mentor = fixtures.mentor("Race Mentor " + round).getId();
                fixtures.mondayHours(mentor, "UTC");
                Session existing = bookingValidator.bookSlot(mentor, menteeId, MONDAY, LocalTime.of(9, 0), 60);
                CyclicBarrier barrier = new CyclicBarrier(2);

                Future<Session> moved = pool.submit(() -> {
                    barrier.await();
                    return sessionService.reschedule(existing.getId(), mentor, "2030-01-07T14:00", null, null);
                });
                Future<Session> fresh = pool.submit(() -> {
                    barrier.await();
                    return bookingValidator.bookSlot(mentor, strangerId, MONDAY, LocalTime.of(14, 30), 30);
                });

                assertThat(BookingValidatorIntegrationTest.winners(List.of(moved, fresh)))
                        .as("round %d", round).isEqualTo(1);
                Session after = sessionRepository.findById(existing.getId()).orElseThrow();
                boolean rescheduleWon = after.getStatus() == SessionStatus.RESCHEDULED;
                assertThat(slotClaimRepository.findBySessionIdOrderByScheduledAt(existing.getId()))
                        .extracting(SlotClaim::getScheduledAt)
                        .containsExactly(rescheduleWon
                                ? new Instant[]{Instant.parse("2030-01-07T14:00:00Z"), Instant.parse("2030-01-07T14:30:00Z")}
                                : new Instant[]{Instant.parse("2030-01-07T09:00:00Z"), Instant.parse("2030-01-07T09:30:00Z")});
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void menteeCannotReschedule() {
        Session booked = book(LocalTime.of(9, 0));

        assertThatThrownBy(() -> sessionService.reschedule(booked.getId(), menteeId, "2030-01-07T14:00", null, null))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void mentorDeclinesRequest() {
        Session booked = book(LocalTime.of(11, 0));

        Session declined = sessionService.decline(booked.getId(), mentorId, "Travelling");

        assertThat(declined.getStatus()).isEqualTo(SessionStatus.CANCELLED);
        assertThat(declined.getCancelledBy()).isEqualTo(Actor.MENTOR);
        assertThat(declined.getCancelledAt()).isEqualTo(TestClockConfig.START);
        verify(notificationPort, timeout(2000)).notify(eq(menteeId), eq(NotificationKind.SESSION_DECLINED), anyMap());
    }

    @Test
    void cancelNotifiesTheOtherPartyAndFreesTheSlot() {
        Session booked = book(LocalTime.of(11, 0));
        sessionService.accept(booked.getId(), mentorId);

        Session cancelled = sessionService.cancel(booked.getId(), menteeId, "Sick");

        assertThat(cancelled.getStatus()).isEqualTo(SessionStatus.CANCELLED);
        assertThat(cancelled.getCancelledBy()).isEqualTo(Actor.MENTEE);
        verify(notificationPort, timeout(2000)).notify(eq(mentorId), eq(NotificationKind.SESSION_CANCELLED), anyMap());
        Session rebooked = bookingValidator.bookSlot(mentorId, strangerId, MONDAY, LocalTime.of(11, 0), null);
        assertThat(rebooked.getId()).isNotEqualTo(booked.getId());

        assertThatThrownBy(() -> sessionService.cancel(booked.getId(), menteeId, null))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void attendanceConfirmationIsPerParty() {
        Session booked = book(LocalTime.of(11, 0));
        sessionService.accept(booked.getId(), mentorId);

        Session afterMentee = sessionService.confirmAttendance(booked.getId(), menteeId);
        assertThat(afterMentee.isMenteeConfirmed()).isTrue();
        assertThat(afterMentee.isMentorConfirmed()).isFalse();
        assertThat(afterMentee.getStatus()).isEqualTo(SessionStatus.CONFIRMED);

        assertThatThrownBy(() -> sessionService.confirmAttendance(booked.getId(), strangerId))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void startOpensShortlyBeforeScheduledTime() {
        Session booked = book(LocalTime.of(11, 0));
        sessionService.accept(booked.getId(), mentorId);

        clock.set(Instant.parse("2030-01-07T10:50:00Z"));
        assertThatThrownBy(() -> sessionService.start(booked.getId(), mentorId))
                .isInstanceOf(InvalidTransitionException.class);

        clock.set(Instant.parse("2030-01-07T10:56:00Z"));
        Session started = sessionService.start(booked.getId(), menteeId);
        assertThat(started.getStatus()).isEqualTo(SessionStatus.IN_PROGRESS);
        assertThat(started.getStartedAt()).isEqualTo(Instant.parse("2030-01-07T10:56:00Z"));

        clock.set(Instant.parse("2030-01-07T11:30:00Z"));
        Session done = sessionService.complete(booked.getId(), mentorId);
        assertThat(done.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(done.getEndedAt()).isEqualTo(Instant.parse("2030-01-07T11:30:00Z"));
        assertThat(slotClaimRepository.findBySessionIdOrderByScheduledAt(booked.getId())).isEmpty();
    }

    @Test
    void failingNotificationDoesNotUndoTheTransition() {
        doThrow(new IllegalStateException("gateway down"))
                .when(notificationPort).notify(anyLong(), any(NotificationKind.class), anyMap());
        Session booked = book(LocalTime.of(13, 0));

        Session accepted = sessionService.accept(booked.getId(), mentorId);

        assertThat(accepted.getStatus()).isEqualTo(SessionStatus.CONFIRMED);
        verify(notificationPort, timeout(2000)).notify(eq(menteeId), eq(NotificationKind.SESSION_CONFIRMED), anyMap());
        assertThat(sessionRepository.findById(booked.getId()).orElseThrow().getStatus()).isEqualTo(SessionStatus.CONFIRMED);
    }

    @Test
    void sessionIsVisibleToParticipantsOnly() {
        Session booked = book(LocalTime.of(13, 0));

        assertThat(sessionService.getSession(booked.getId(), mentorId).getId()).isEqualTo(booked.getId());
        assertThat(sessionService.getSession(booked.getId(), menteeId).getId()).isEqualTo(booked.getId());
        assertThatThrownBy(() -> sessionService.getSession(booked.getId(), strangerId))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> sessionService.getSession(987654L, mentorId))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void listsSessionsInTimeOrderWithFilters() {
        Session late = book(LocalTime.of(15, 0));
        Session early = book(LocalTime.of(9, 0));
        Session other = bookingValidator.bookSlot(mentorId, strangerId, MONDAY, LocalTime.of(10, 0), null);
        sessionService.accept(early.getId(), mentorId);

        SessionPageResponse asMentor = sessionService.listSessions(mentorId, "mentor", null, null, null, null);
        assertThat(asMentor.sessions()).extracting(SessionResponse::id)
                .containsExactly(early.getId(), other.getId(), late.getId());
        assertThat(asMentor.total()).isEqualTo(3);
        assertThat(asMentor.limit()).isEqualTo(20);

        SessionPageResponse asMentee = sessionService.listSessions(menteeId, null, null, true, null, null);
        assertThat(asMentee.sessions()).extracting(SessionResponse::id)
                .containsExactly(early.getId(), late.getId());

        SessionPageResponse confirmed = sessionService.listSessions(mentorId, "mentor", "confirmed", null, null, null);
        assertThat(confirmed.sessions()).extracting(SessionResponse::id).containsExactly(early.getId());

        SessionPageResponse secondPage = sessionService.listSessions(mentorId, "mentor", null, null, 2, 2);
        assertThat(secondPage.sessions()).extracting(SessionResponse::id).containsExactly(late.getId());
        assertThat(secondPage.pages()).isEqualTo(2);

        assertThat(sessionService.listSessions(mentorId, null, null, false, null, null).sessions()).isEmpty();
        assertThatThrownBy(() -> sessionService.listSessions(mentorId, "admin", null, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> sessionService.listSessions(mentorId, null, null, null, 0, null))
                .isInstanceOf(ValidationException.class);
    }

    private Session book(LocalTime time) {
        return bookingValidator.bookSlot(mentorId, menteeId, MONDAY, time, null);
    }
}
