package com.mentorship.scheduling.exception;

public class NotFoundException extends SchedulingException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
