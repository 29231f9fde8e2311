package com.mentorship.scheduling.port;

import java.util.Map;

/**
 * Fire-and-forget e-mail delivery. Rendering of the message body is the relay's job.
 */
public interface EmailPort {

    void send(UserProfile recipient, NotificationKind kind, Map<String, Object> payload);
}
