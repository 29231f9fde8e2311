package com.mentorship.scheduling.exception;

public class ValidationException extends SchedulingException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }
}
