package com.mentorship.scheduling.dto;

import com.mentorship.scheduling.utils.TimeFormats;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record BreakRequest(
        @NotBlank @Pattern(regexp = TimeFormats.WALL_CLOCK_PATTERN, message = "Invalid break start time format") String startTime,
        @NotBlank @Pattern(regexp = TimeFormats.WALL_CLOCK_PATTERN, message = "Invalid break end time format") String endTime,
        @Size(max = 200, message = "Break reason too long") String reason) {
}
