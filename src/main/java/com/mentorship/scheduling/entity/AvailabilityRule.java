package com.mentorship.scheduling.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A mentor's declared availability for one weekday (recurring) or one calendar date (override).
 */
@Entity
@Table(name = "availability_rule", indexes = {
    @Index(name = "idx_availability_rule_mentor", columnList = "mentor_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AvailabilityRule {

    public enum Status { AVAILABLE, UNAVAILABLE }

    public static final int DEFAULT_SLOT_DURATION_MINUTES = 30;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "mentor_id", nullable = false)
    private Long mentorId;

    /**
     * Day of week: 0 = Sunday ... 6 = Saturday. For overrides this is derived from specificDate.
     */
    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "specific_date")
    private LocalDate specificDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "slot_duration_minutes", nullable = false)
    @Builder.Default
    private int slotDurationMinutes = DEFAULT_SLOT_DURATION_MINUTES;

    @Column(nullable = false, length = 64)
    private String timezone;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "availability_break", joinColumns = @JoinColumn(name = "rule_id"))
    @OrderBy("startTime ASC")
    @Builder.Default
    private List<AvailabilityBreak> breaks = new ArrayList<>();

    @Column(nullable = false)
    @Builder.Default
    private boolean recurring = true;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.AVAILABLE;

    @Column(length = 500)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

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

    /** Maps java.time's Monday=1..Sunday=7 onto the stored Sunday=0..Saturday=6. */
    public static int dayOfWeekOf(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }
}
