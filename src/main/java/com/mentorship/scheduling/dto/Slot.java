package com.mentorship.scheduling.dto;

/**
 * A bookable candidate for one date: wall-clock start in the mentor's zone plus whether it can be booked now.
 */
public record Slot(String time, boolean available) {
}
