package com.mentorship.scheduling.session;

import com.mentorship.scheduling.port.NotificationKind;

import java.util.List;
import java.util.Map;

/**
 * Published inside the transaction that changed a session; delivered to listeners after commit.
 */
public record SessionEvent(Long sessionId, NotificationKind kind, List<Long> recipients, Map<String, Object> payload) {
}
