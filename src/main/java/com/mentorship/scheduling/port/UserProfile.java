package com.mentorship.scheduling.port;

import com.mentorship.scheduling.entity.UserRole;

public record UserProfile(Long id, String displayName, String email, String pushToken, String timezone, UserRole role) {

    public boolean isMentor() {
        return role == UserRole.MENTOR;
    }

    public boolean isMentee() {
        return role == UserRole.MENTEE;
    }
}
