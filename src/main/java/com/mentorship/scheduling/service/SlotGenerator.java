package com.mentorship.scheduling.service;

import com.mentorship.scheduling.dto.Slot;
import com.mentorship.scheduling.entity.AvailabilityBreak;
import com.mentorship.scheduling.entity.AvailabilityRule;
import com.mentorship.scheduling.entity.Session;
import com.mentorship.scheduling.utils.TimeFormats;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Pure slot arithmetic over one resolved availability rule. No repository access: callers pass in the
 * rule, the mentor's slot-occupying sessions around the date and the current instant.
 * <p>
 * Times are handled as minutes of day so windows ending at 23:59 never wrap past midnight.
 */
@Component
public class SlotGenerator {

    public record CandidateSlot(LocalTime start, LocalTime end, Instant startsAt, Instant endsAt,
                                boolean inBreak, boolean booked, boolean past) {

        public boolean available() {
            return !inBreak && !booked && !past;
        }

        public Slot toSlot() {
            return new Slot(TimeFormats.format(start), available());
        }
    }

    public List<Slot> generate(AvailabilityRule rule, LocalDate date, Collection<Session> occupying, Instant now) {
        return candidates(rule, date, occupying, now).stream()
                .map(CandidateSlot::toSlot)
                .toList();
    }

    /**
     * Partitions the rule's window into fixed-width slots. A trailing window shorter than a slot is dropped,
     * as is a slot whose start falls in a daylight-saving gap on {@code date}.
     */
    public List<CandidateSlot> candidates(AvailabilityRule rule, LocalDate date, Collection<Session> occupying, Instant now) {
        if (rule == null || rule.getStatus() == AvailabilityRule.Status.UNAVAILABLE) {
            return List.of();
        }
        int width = rule.getSlotDurationMinutes();
        if (width <= 0) {
            return List.of();
        }
        ZoneId zone = ZoneId.of(rule.getTimezone());
        int windowStart = minuteOfDay(rule.getStartTime());
        int windowEnd = minuteOfDay(rule.getEndTime());

        List<CandidateSlot> slots = new ArrayList<>();
        for (int m = windowStart; m + width <= windowEnd; m += width) {
            LocalTime start = LocalTime.ofSecondOfDay(m * 60L);
            if (!existsOn(date, start, zone)) {
                continue;
            }
            Instant startsAt = toInstant(date, start, zone);
            Instant endsAt = startsAt.plusSeconds(width * 60L);
            slots.add(new CandidateSlot(
                    start,
                    start.plusMinutes(width),
                    startsAt,
                    endsAt,
                    overlapsBreak(rule, m, m + width),
                    overlapsAny(occupying, startsAt, endsAt, null),
                    !startsAt.isAfter(now)));
        }
        return slots;
    }

    public Optional<CandidateSlot> candidateAt(AvailabilityRule rule, LocalDate date, LocalTime time,
                                               Collection<Session> occupying, Instant now) {
        return candidates(rule, date, occupying, now).stream()
                .filter(c -> c.start().equals(time))
                .findFirst();
    }

    /** True when [startMinute, endMinute) lies inside the rule's window. */
    public boolean withinWindow(AvailabilityRule rule, int startMinute, int endMinute) {
        return startMinute >= minuteOfDay(rule.getStartTime()) && endMinute <= minuteOfDay(rule.getEndTime());
    }

    public boolean overlapsBreak(AvailabilityRule rule, int startMinute, int endMinute) {
        if (rule.getBreaks() == null) {
            return false;
        }
        for (AvailabilityBreak b : rule.getBreaks()) {
            if (startMinute < minuteOfDay(b.getEndTime()) && minuteOfDay(b.getStartTime()) < endMinute) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether any session other than {@code excludeSessionId} overlaps [startsAt, endsAt).
     */
    public boolean overlapsAny(Collection<Session> sessions, Instant startsAt, Instant endsAt, Long excludeSessionId) {
        if (sessions == null) {
            return false;
        }
        for (Session s : sessions) {
            if (excludeSessionId != null && excludeSessionId.equals(s.getId())) continue;
            if (!s.getStatus().isSlotOccupying()) continue;
            if (startsAt.isBefore(s.getEndsAt()) && s.getScheduledAt().isBefore(endsAt)) {
                return true;
            }
        }
        return false;
    }

    /** Wall-clock to instant; a time inside a DST gap moves forward by the gap length. */
    public static Instant toInstant(LocalDate date, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(date, time, zone).toInstant();
    }

    /** False for a wall-clock time skipped by a daylight-saving transition. */
    public static boolean existsOn(LocalDate date, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(date, time, zone).toLocalTime().equals(time);
    }

    public static int minuteOfDay(LocalTime time) {
        return time.toSecondOfDay() / 60;
    }
}
