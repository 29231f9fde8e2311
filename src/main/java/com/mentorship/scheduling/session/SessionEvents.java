package com.mentorship.scheduling.session;

import com.mentorship.scheduling.entity.Session;
import com.mentorship.scheduling.port.NotificationKind;

import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SessionEvents {

    private SessionEvents() {
    }

    public static SessionEvent of(Session session, NotificationKind kind, Long... recipients) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", session.getId());
        payload.put("kind", kind.wireValue());
        payload.put("status", session.getStatus().wireValue());
        payload.put("scheduledAt", session.getScheduledAt().toString());
        payload.put("localScheduledAt", session.getScheduledAt().atZone(ZoneId.of(session.getTimezone())).toLocalDateTime().toString());
        payload.put("timezone", session.getTimezone());
        payload.put("durationMinutes", session.getDurationMinutes());
        payload.put("mentorId", session.getMentorId());
        payload.put("menteeId", session.getMenteeId());
        if (session.getPreviousScheduledAt() != null) {
            payload.put("previousScheduledAt", session.getPreviousScheduledAt().toString());
        }
        if (session.getRescheduleReason() != null) {
            payload.put("rescheduleReason", session.getRescheduleReason());
        }
        if (session.getRescheduleMessage() != null) {
            payload.put("rescheduleMessage", session.getRescheduleMessage());
        }
        if (session.getCancellationReason() != null) {
            payload.put("cancellationReason", session.getCancellationReason());
        }
        return new SessionEvent(session.getId(), kind, List.of(recipients), Map.copyOf(payload));
    }
}
