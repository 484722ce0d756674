package com.twosome.backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base type for failures surfaced to API callers. Each subclass fixes the HTTP status
 * and the machine-readable error code written by {@link GlobalExceptionHandler}.
 */
@Getter
public abstract class CoupleApiException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    protected CoupleApiException(HttpStatus status, String errorCode, String message) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    protected CoupleApiException(HttpStatus status, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }
}
