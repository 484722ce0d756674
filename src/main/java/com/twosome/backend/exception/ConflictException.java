package com.twosome.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * The request lost against current state (already paired, duplicate invitation, full couple).
 * Callers may retry after re-reading state.
 */
public class ConflictException extends CoupleApiException {

    public ConflictException(String message) {
        super(HttpStatus.CONFLICT, "CONFLICT", message);
    }

    public ConflictException(String message, Throwable cause) {
        super(HttpStatus.CONFLICT, "CONFLICT", message, cause);
    }
}
