package com.twosome.backend.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(PairingInvariantException.class)
    public ResponseEntity<Map<String, String>> handleFatal(PairingInvariantException exc) {
        log.error("RECONCILIATION REQUIRED: pairing invariant may be broken: {}", exc.getMessage(), exc);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "Something went wrong. Please try again later.");
    }

    @ExceptionHandler(CoupleApiException.class)
    public ResponseEntity<Map<String, String>> handleApiException(CoupleApiException exc) {
        return body(exc.getStatus(), exc.getErrorCode(), exc.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception exc) {
        return body(HttpStatus.BAD_REQUEST, "INVALID_INPUT", exc.getMessage());
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, String>> handleConstraintRace(DataIntegrityViolationException exc) {
        log.warn("Constraint violation treated as lost race: {}", exc.getMostSpecificCause().getMessage());
        return body(HttpStatus.CONFLICT, "CONFLICT", "The request conflicts with a concurrent change. Please retry.");
    }

    @ExceptionHandler({OptimisticLockingFailureException.class, PessimisticLockingFailureException.class})
    public ResponseEntity<Map<String, String>> handleLockFailure(RuntimeException exc) {
        log.warn("Locking failure treated as lost race: {}", exc.getMessage());
        return body(HttpStatus.CONFLICT, "CONFLICT", "The request conflicts with a concurrent change. Please retry.");
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> handleResponseStatus(ResponseStatusException exc) {
        HttpStatus status = HttpStatus.valueOf(exc.getStatusCode().value());
        return body(status, status.name(), exc.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneralException(Exception exc) {
        log.error("Unhandled exception", exc);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", exc.getMessage());
    }

    private ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String message) {
        Map<String, String> response = new HashMap<>();
        response.put("error", error);
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
