package com.mentorship.scheduling.component;

import com.mentorship.scheduling.port.EmailPort;
import com.mentorship.scheduling.port.NotificationPort;
import com.mentorship.scheduling.port.UserDirectory;
import com.mentorship.scheduling.session.SessionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Delivers session notifications once the transition has committed. A rolled-back transition sends
 * nothing, and a failing channel never reaches the caller.
 */
@Component
public class SessionNotificationListener {

    private static final Logger log = LoggerFactory.getLogger(SessionNotificationListener.class);

    private final NotificationPort notificationPort;
    private final EmailPort emailPort;
    private final UserDirectory userDirectory;

    public SessionNotificationListener(NotificationPort notificationPort, EmailPort emailPort, UserDirectory userDirectory) {
        this.notificationPort = notificationPort;
        this.emailPort = emailPort;
        this.userDirectory = userDirectory;
    }

    @Async("notificationExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onSessionEvent(SessionEvent event) {
        for (Long recipient : event.recipients()) {
            try {
                notificationPort.notify(recipient, event.kind(), event.payload());
            } catch (Exception e) {
                log.error("Push {} for session {} to user {} failed", event.kind().wireValue(), event.sessionId(), recipient, e);
            }
            try {
                userDirectory.getUser(recipient).ifPresent(user -> emailPort.send(user, event.kind(), event.payload()));
            } catch (Exception e) {
                log.error("E-mail {} for session {} to user {} failed", event.kind().wireValue(), event.sessionId(), recipient, e);
            }
        }
    }
}
