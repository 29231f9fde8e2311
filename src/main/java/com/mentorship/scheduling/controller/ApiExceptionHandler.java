package com.mentorship.scheduling.controller;

import com.mentorship.scheduling.dto.ErrorResponse;
import com.mentorship.scheduling.exception.ErrorKind;
import com.mentorship.scheduling.exception.SchedulingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Renders every rejection as {@code {kind, message, retryable}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SchedulingException.class)
    public ResponseEntity<ErrorResponse> handleScheduling(SchedulingException ex) {
        ErrorKind kind = ex.getKind();
        if (kind == ErrorKind.CLAIM_TIMEOUT) {
            log.warn("{}: {}", kind, ex.getMessage());
        } else {
            log.debug("{}: {}", kind, ex.getMessage());
        }
        return respond(kind, ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(ApiExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return respond(ErrorKind.VALIDATION_ERROR, message.isEmpty() ? "Invalid request" : message);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        String message = ex instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : ex.getMessage();
        return respond(ErrorKind.VALIDATION_ERROR, message);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        // framework rejections (unknown route, wrong method) keep their own status
        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            return ResponseEntity.status(framework.getStatusCode())
                    .body(new ErrorResponse("REQUEST_REJECTED", ex.getMessage(), false));
        }
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "Unexpected error", false));
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorKind kind, String message) {
        return ResponseEntity.status(kind.getHttpStatus())
                .body(new ErrorResponse(kind.name(), message, kind.isRetryable()));
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}
