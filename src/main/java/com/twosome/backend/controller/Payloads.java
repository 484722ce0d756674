package com.twosome.backend.controller;

import com.twosome.backend.exception.InvalidInputException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Typed reads from loosely-typed JSON request bodies.
 */
final class Payloads {

    private Payloads() {
    }

    static String optionalString(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new InvalidInputException(field + " must be a string");
        }
        return (String) value;
    }

    static String requiredString(Map<String, Object> payload, String field) {
        String value = optionalString(payload, field);
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(field + " is required");
        }
        return value;
    }

    static Long optionalLong(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.valueOf(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException(field + " must be a number");
        }
    }

    /**
     * Accepts {@code yyyy-MM-dd}, or an ISO date-time whose date part is used.
     */
    static LocalDate requiredDate(Map<String, Object> payload, String field) {
        String value = requiredString(payload, field).trim();
        try {
            if (value.length() > 10 && value.charAt(10) == 'T') {
                value = value.substring(0, 10);
            }
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidInputException(field + " must be a date (yyyy-MM-dd)");
        }
    }

    static Map<String, Object> requiredObject(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (!(value instanceof Map)) {
            throw new InvalidInputException(field + " must be an object");
        }
        return (Map<String, Object>) value;
    }
}
