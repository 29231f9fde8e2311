package com.mentorship.scheduling.exception;

/**
 * Another booking already holds the instant, either found by the pre-check or by losing the
 * race on the slot claim.
 */
public class SlotConflictException extends SchedulingException {

    public SlotConflictException(String message) {
        super(ErrorKind.SLOT_CONFLICT, message);
    }

    public SlotConflictException(String message, Throwable cause) {
        super(ErrorKind.SLOT_CONFLICT, message, cause);
    }
}
