package com.mentorship.scheduling.entity;

public enum UserRole {
    MENTOR,
    MENTEE
}
