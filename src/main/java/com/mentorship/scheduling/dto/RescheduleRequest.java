package com.mentorship.scheduling.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RescheduleRequest(@NotBlank(message = "New scheduled time is required") String newScheduledAt,
                                @Size(max = 500, message = "Reason too long") String reason,
                                @Size(max = 1000, message = "Message too long") String message) {
}
