package com.mentorship.scheduling.exception;

public class ClaimTimeoutException extends SchedulingException {

    public ClaimTimeoutException(String message, Throwable cause) {
        super(ErrorKind.CLAIM_TIMEOUT, message, cause);
    }
}
