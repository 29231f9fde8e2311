package com.mentorship.scheduling.session;

/**
 * Who is driving a transition. SYSTEM covers time-driven passes such as the missed-session sweep.
 */
public enum Actor {
    MENTOR,
    MENTEE,
    SYSTEM
}
