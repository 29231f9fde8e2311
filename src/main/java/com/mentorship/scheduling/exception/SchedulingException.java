package com.mentorship.scheduling.exception;

public abstract class SchedulingException extends RuntimeException {

    private final ErrorKind kind;

    protected SchedulingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected SchedulingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
