package com.mentorship.scheduling.dto;

import jakarta.validation.constraints.Size;

public record CancelRequest(@Size(max = 500, message = "Reason too long") String reason) {
}
