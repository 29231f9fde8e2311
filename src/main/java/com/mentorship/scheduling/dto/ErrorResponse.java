package com.mentorship.scheduling.dto;

public record ErrorResponse(String kind, String message, boolean retryable) {
}
