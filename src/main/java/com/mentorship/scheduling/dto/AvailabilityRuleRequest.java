package com.mentorship.scheduling.dto;

import com.mentorship.scheduling.utils.TimeFormats;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.util.List;

/**
 * Create-or-update payload for one availability rule. Supplying {@code specificDate} makes it an override
 * and {@code dayOfWeek} is then derived from the date.
 */
@Builder
public record AvailabilityRuleRequest(
        @Min(0) @Max(6) Integer dayOfWeek,
        @NotBlank @Pattern(regexp = TimeFormats.WALL_CLOCK_PATTERN, message = "Invalid time format. Use HH:MM format") String startTime,
        @NotBlank @Pattern(regexp = TimeFormats.WALL_CLOCK_PATTERN, message = "Invalid time format. Use HH:MM format") String endTime,
        @Min(value = 15, message = "Minimum slot duration is 15 minutes")
        @Max(value = 240, message = "Maximum slot duration is 240 minutes") Integer slotDuration,
        @NotBlank(message = "Timezone is required") @Size(max = 64) String timezone,
        String specificDate,
        @Valid List<BreakRequest> breaks,
        @Pattern(regexp = "(?i)available|unavailable", message = "status must be available or unavailable") String status,
        @Size(max = 500, message = "Notes too long") String notes) {
}
