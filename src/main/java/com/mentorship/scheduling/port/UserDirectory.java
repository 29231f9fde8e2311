package com.mentorship.scheduling.port;

import java.util.Optional;

/**
 * Read-only view of platform users, used to resolve session parties and address notifications.
 */
public interface UserDirectory {

    Optional<UserProfile> getUser(Long id);
}
