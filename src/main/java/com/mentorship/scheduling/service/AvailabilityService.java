package com.mentorship.scheduling.service;

import com.mentorship.scheduling.dto.AvailabilityRuleRequest;
import com.mentorship.scheduling.dto.BreakRequest;
import com.mentorship.scheduling.entity.AvailabilityBreak;
import com.mentorship.scheduling.entity.AvailabilityRule;
import com.mentorship.scheduling.exception.NotFoundException;
import com.mentorship.scheduling.exception.ValidationException;
import com.mentorship.scheduling.port.UserDirectory;
import com.mentorship.scheduling.port.UserProfile;
import com.mentorship.scheduling.repository.AvailabilityRuleRepository;
import com.mentorship.scheduling.utils.TimeFormats;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Mentor-owned availability rules. Editing a rule never touches sessions that are already booked;
 * the next slot listing simply reflects the new rule.
 */
@Service
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    private final AvailabilityRuleRepository ruleRepository;
    private final UserDirectory userDirectory;

    public AvailabilityService(AvailabilityRuleRepository ruleRepository, UserDirectory userDirectory) {
        this.ruleRepository = ruleRepository;
        this.userDirectory = userDirectory;
    }

    /**
     * Creates the rule, or updates the existing one with the same key: (mentor, weekday) for recurring
     * rules and (mentor, date) for overrides.
     */
    @Transactional
    public AvailabilityRule saveRule(Long mentorId, AvailabilityRuleRequest request) {
        requireMentor(mentorId);

        LocalTime start = TimeFormats.parseTime(request.startTime(), "startTime");
        LocalTime end = TimeFormats.parseTime(request.endTime(), "endTime");
        ZoneId zone = TimeFormats.parseZone(request.timezone());
        int slotDuration = request.slotDuration() != null
                ? request.slotDuration()
                : AvailabilityRule.DEFAULT_SLOT_DURATION_MINUTES;
        List<AvailabilityBreak> breaks = toBreaks(request.breaks());
        validateWindow(start, end, slotDuration, breaks);

        LocalDate specificDate = StringUtils.isNotBlank(request.specificDate())
                ? TimeFormats.parseDate(request.specificDate(), "specificDate")
                : null;
        int dayOfWeek;
        if (specificDate != null) {
            dayOfWeek = AvailabilityRule.dayOfWeekOf(specificDate);
        } else if (request.dayOfWeek() != null) {
            dayOfWeek = request.dayOfWeek();
            if (dayOfWeek < 0 || dayOfWeek > 6) {
                throw new ValidationException("dayOfWeek must be between 0 (Sunday) and 6 (Saturday)");
            }
        } else {
            throw new ValidationException("Either dayOfWeek or specificDate is required");
        }

        AvailabilityRule.Status status = StringUtils.isBlank(request.status())
                ? AvailabilityRule.Status.AVAILABLE
                : AvailabilityRule.Status.valueOf(request.status().trim().toUpperCase());

        Optional<AvailabilityRule> existing = specificDate != null
                ? ruleRepository.findFirstByMentorIdAndRecurringFalseAndSpecificDate(mentorId, specificDate)
                : ruleRepository.findFirstByMentorIdAndRecurringTrueAndDayOfWeek(mentorId, dayOfWeek);

        AvailabilityRule rule = existing.orElseGet(() -> AvailabilityRule.builder()
                .mentorId(mentorId)
                .build());
        rule.setDayOfWeek(dayOfWeek);
        rule.setSpecificDate(specificDate);
        rule.setRecurring(specificDate == null);
        rule.setStartTime(start);
        rule.setEndTime(end);
        rule.setSlotDurationMinutes(slotDuration);
        rule.setTimezone(zone.getId());
        rule.getBreaks().clear();
        rule.getBreaks().addAll(breaks);
        rule.setStatus(status);
        rule.setNotes(request.notes());

        AvailabilityRule saved = ruleRepository.save(rule);
        log.info("{} availability rule {} for mentor {} ({})",
                existing.isPresent() ? "Updated" : "Created",
                saved.getId(), mentorId,
                specificDate != null ? "override " + specificDate : "weekday " + dayOfWeek);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<AvailabilityRule> getRules(Long mentorId) {
        requireMentor(mentorId);
        return ruleRepository.findByMentorIdOrderByDayOfWeekAscStartTimeAsc(mentorId);
    }

    @Transactional
    public void deleteRule(Long ruleId, Long mentorId) {
        AvailabilityRule rule = ruleRepository.findById(ruleId)
                .filter(r -> r.getMentorId().equals(mentorId))
                .orElseThrow(() -> new NotFoundException("Availability rule " + ruleId + " not found"));
        ruleRepository.delete(rule);
        log.info("Deleted availability rule {} for mentor {}", ruleId, mentorId);
    }

    /**
     * The rule in force on {@code date}: a date override wins over the recurring weekday rule.
     * An unavailable rule is still returned; callers treat it as a closed day.
     */
    @Transactional(readOnly = true)
    public Optional<AvailabilityRule> resolveRule(Long mentorId, LocalDate date) {
        Optional<AvailabilityRule> override = ruleRepository.findFirstByMentorIdAndRecurringFalseAndSpecificDate(mentorId, date);
        if (override.isPresent()) {
            return override;
        }
        return ruleRepository.findFirstByMentorIdAndRecurringTrueAndDayOfWeek(mentorId, AvailabilityRule.dayOfWeekOf(date));
    }

    public UserProfile requireMentor(Long mentorId) {
        return userDirectory.getUser(mentorId)
                .filter(UserProfile::isMentor)
                .orElseThrow(() -> new NotFoundException("Mentor " + mentorId + " not found"));
    }

    private static List<AvailabilityBreak> toBreaks(List<BreakRequest> requests) {
        List<AvailabilityBreak> breaks = new ArrayList<>();
        if (requests == null) return breaks;
        for (BreakRequest b : requests) {
            breaks.add(AvailabilityBreak.builder()
                    .startTime(TimeFormats.parseTime(b.startTime(), "break startTime"))
                    .endTime(TimeFormats.parseTime(b.endTime(), "break endTime"))
                    .reason(StringUtils.trimToNull(b.reason()))
                    .build());
        }
        breaks.sort(Comparator.comparing(AvailabilityBreak::getStartTime));
        return breaks;
    }

    static void validateWindow(LocalTime start, LocalTime end, int slotDuration, List<AvailabilityBreak> breaks) {
        if (!start.isBefore(end)) {
            throw new ValidationException("startTime must be before endTime");
        }
        int windowMinutes = SlotGenerator.minuteOfDay(end) - SlotGenerator.minuteOfDay(start);
        if (slotDuration <= 0 || slotDuration > windowMinutes) {
            throw new ValidationException("slotDuration must be positive and fit inside the " + windowMinutes + " minute window");
        }
        LocalTime previousEnd = null;
        for (AvailabilityBreak b : breaks) {
            if (!b.getStartTime().isBefore(b.getEndTime())) {
                throw new ValidationException("Break " + TimeFormats.format(b.getStartTime()) + " must start before it ends");
            }
            if (b.getStartTime().isBefore(start) || b.getEndTime().isAfter(end)) {
                throw new ValidationException("Break " + TimeFormats.format(b.getStartTime()) + "-"
                        + TimeFormats.format(b.getEndTime()) + " is outside the availability window");
            }
            // breaks are sorted by start
            if (previousEnd != null && b.getStartTime().isBefore(previousEnd)) {
                throw new ValidationException("Breaks must not overlap");
            }
            previousEnd = b.getEndTime();
        }
    }
}
