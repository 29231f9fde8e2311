package com.mentorship.scheduling.port;

import java.util.Map;

/**
 * Fire-and-forget push delivery. Implementations log their own delivery failures and must not throw.
 */
public interface NotificationPort {

    void notify(Long userId, NotificationKind kind, Map<String, Object> payload);
}
