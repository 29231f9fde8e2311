package com.mentorship.scheduling.exception;

public class SlotUnavailableException extends SchedulingException {

    public SlotUnavailableException(String message) {
        super(ErrorKind.SLOT_UNAVAILABLE, message);
    }
}
