package com.mentorship.scheduling.dto;

import com.mentorship.scheduling.entity.Session;

import java.time.Instant;
import java.time.ZoneId;

public record SessionResponse(Long id, Long mentorId, Long menteeId, Instant scheduledAt, String localScheduledAt,
                              String timezone, int durationMinutes, String status, Instant requestedScheduledAt,
                              Instant previousScheduledAt, String rescheduleReason, String rescheduleMessage,
                              String cancellationReason, String cancelledBy, Instant cancelledAt,
                              boolean mentorConfirmed, boolean menteeConfirmed, Instant startedAt, Instant endedAt,
                              Instant createdAt, Instant updatedAt) {

    public static SessionResponse from(Session s) {
        return new SessionResponse(
                s.getId(),
                s.getMentorId(),
                s.getMenteeId(),
                s.getScheduledAt(),
                s.getScheduledAt().atZone(ZoneId.of(s.getTimezone())).toLocalDateTime().toString(),
                s.getTimezone(),
                s.getDurationMinutes(),
                s.getStatus().wireValue(),
                s.getRequestedScheduledAt(),
                s.getPreviousScheduledAt(),
                s.getRescheduleReason(),
                s.getRescheduleMessage(),
                s.getCancellationReason(),
                s.getCancelledBy() != null ? s.getCancelledBy().name().toLowerCase() : null,
                s.getCancelledAt(),
                s.isMentorConfirmed(),
                s.isMenteeConfirmed(),
                s.getStartedAt(),
                s.getEndedAt(),
                s.getCreatedAt(),
                s.getUpdatedAt());
    }
}
