package com.mentorship.scheduling.utils;

import com.mentorship.scheduling.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parsing of the wall-clock formats used on the API. Every failure is a {@link ValidationException}.
 */
public final class TimeFormats {

    /** Accepts 9:00 and 09:00, always renders 09:00. */
    public static final DateTimeFormatter WALL_CLOCK_IN = DateTimeFormatter.ofPattern("H:mm");
    public static final DateTimeFormatter WALL_CLOCK_OUT = DateTimeFormatter.ofPattern("HH:mm");

    public static final String WALL_CLOCK_PATTERN = "^([0-1]?[0-9]|2[0-3]):[0-5][0-9]$";

    private TimeFormats() {
    }

    public static LocalDate parseDate(String value, String field) {
        if (StringUtils.isBlank(value)) {
            throw new ValidationException(field + " is required");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid " + field + " '" + value + "', expected yyyy-MM-dd");
        }
    }

    public static LocalTime parseTime(String value, String field) {
        if (StringUtils.isBlank(value) || !value.trim().matches(WALL_CLOCK_PATTERN)) {
            throw new ValidationException("Invalid " + field + " '" + value + "', expected HH:MM");
        }
        return LocalTime.parse(value.trim(), WALL_CLOCK_IN);
    }

    /**
     * Parses a wall-clock date-time such as 2026-11-02T09:00; seconds are accepted but must be zero.
     */
    public static LocalDateTime parseWallClock(String value, String field) {
        if (StringUtils.isBlank(value)) {
            throw new ValidationException(field + " is required");
        }
        LocalDateTime parsed;
        try {
            parsed = LocalDateTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid " + field + " '" + value + "', expected yyyy-MM-ddTHH:mm");
        }
        if (parsed.getSecond() != 0 || parsed.getNano() != 0) {
            throw new ValidationException(field + " must be on a whole minute");
        }
        return parsed;
    }

    public static ZoneId parseZone(String value) {
        if (StringUtils.isBlank(value)) {
            throw new ValidationException("timezone is required");
        }
        try {
            return ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            throw new ValidationException("Unknown timezone '" + value + "'");
        }
    }

    public static String format(LocalTime time) {
        return time.format(WALL_CLOCK_OUT);
    }
}
