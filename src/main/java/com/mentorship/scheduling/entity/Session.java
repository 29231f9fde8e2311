package com.mentorship.scheduling.entity;

import com.mentorship.scheduling.session.Actor;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;

@Entity
@Table(name = "session", indexes = {
    @Index(name = "idx_session_mentor_scheduled", columnList = "mentor_id, scheduled_at"),
    @Index(name = "idx_session_mentee", columnList = "mentee_id"),
    @Index(name = "idx_session_status_scheduled", columnList = "status, scheduled_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Session {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "mentor_id", nullable = false)
    private Long mentorId;

    @Column(name = "mentee_id", nullable = false)
    private Long menteeId;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    /** Zone the session was booked in; display only. */
    @Column(nullable = false, length = 64)
    private String timezone;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private SessionStatus status = SessionStatus.SCHEDULED;

    /** The mentee's original ask; survives reschedules. */
    @Column(name = "requested_scheduled_at")
    private Instant requestedScheduledAt;

    @Column(name = "previous_scheduled_at")
    private Instant previousScheduledAt;

    @Column(name = "reschedule_requested_at")
    private Instant rescheduleRequestedAt;

    @Column(name = "reschedule_reason", length = 500)
    private String rescheduleReason;

    @Column(name = "reschedule_message", length = 1000)
    private String rescheduleMessage;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "cancelled_by", length = 20)
    private Actor cancelledBy;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "mentor_confirmed", nullable = false)
    private boolean mentorConfirmed;

    @Column(name = "mentee_confirmed", nullable = false)
    private boolean menteeConfirmed;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public Instant getEndsAt() {
        return scheduledAt.plus(Duration.ofMinutes(durationMinutes));
    }

    public boolean involves(Long userId) {
        return userId != null && (userId.equals(mentorId) || userId.equals(menteeId));
    }
}
