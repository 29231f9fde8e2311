package com.mentorship.scheduling.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdateStatusRequest(
        @NotBlank @Pattern(regexp = "(?i)scheduled|confirmed|rescheduled|in_progress|completed|cancelled|no_show",
                message = "Invalid session status") String status,
        @Size(max = 500, message = "Reason too long") String reason) {
}
