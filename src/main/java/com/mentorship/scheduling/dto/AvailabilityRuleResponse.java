package com.mentorship.scheduling.dto;

import com.mentorship.scheduling.entity.AvailabilityRule;
import com.mentorship.scheduling.utils.TimeFormats;

import java.util.List;

public record AvailabilityRuleResponse(Long id, Long mentorId, int dayOfWeek, String specificDate,
                                       String startTime, String endTime, int slotDuration, String timezone,
                                       List<BreakView> breaks, boolean recurring, String status, String notes) {

    public record BreakView(String startTime, String endTime, String reason) {
    }

    public static AvailabilityRuleResponse from(AvailabilityRule rule) {
        return new AvailabilityRuleResponse(
                rule.getId(),
                rule.getMentorId(),
                rule.getDayOfWeek(),
                rule.getSpecificDate() != null ? rule.getSpecificDate().toString() : null,
                TimeFormats.format(rule.getStartTime()),
                TimeFormats.format(rule.getEndTime()),
                rule.getSlotDurationMinutes(),
                rule.getTimezone(),
                rule.getBreaks().stream()
                        .map(b -> new BreakView(TimeFormats.format(b.getStartTime()), TimeFormats.format(b.getEndTime()), b.getReason()))
                        .toList(),
                rule.isRecurring(),
                rule.getStatus().name().toLowerCase(),
                rule.getNotes());
    }
}
