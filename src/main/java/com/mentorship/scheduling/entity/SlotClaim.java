package com.mentorship.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Reservation of a (mentor, instant) pair by a slot-occupying session. A session holds one row per
 * slot-grid instant it covers, so two sessions that overlap at all collide on the unique constraint.
 * That constraint is what makes a booking atomic across processes: the rows exist exactly while
 * their session holds the slot.
 */
@Entity
@Table(name = "slot_claim", uniqueConstraints = {
    @UniqueConstraint(name = "uk_slot_claim_mentor_instant", columnNames = {"mentor_id", "scheduled_at"})
}, indexes = {
    @Index(name = "idx_slot_claim_session", columnList = "session_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SlotClaim {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "mentor_id", nullable = false)
    private Long mentorId;

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "session_id", nullable = false)
    private Long sessionId;

    @Column(name = "claimed_at", nullable = false, updatable = false)
    private Instant claimedAt;

    @PrePersist
    protected void onCreate() {
        if (claimedAt == null) claimedAt = Instant.now();
    }
}
