package com.mentorship.scheduling.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * @param scheduledAt wall-clock start in the mentor's availability timezone, e.g. 2026-11-02T09:00
 * @param duration    minutes; defaults to the slot width of the mentor's rule for that date
 */
public record CreateSessionRequest(@NotNull(message = "mentorId is required") Long mentorId,
                                   @NotBlank(message = "scheduledAt is required") String scheduledAt,
                                   Integer duration) {
}
