package com.twosome.backend.exception;

import org.springframework.http.HttpStatus;

public class InvalidInputException extends CoupleApiException {

    public InvalidInputException(String message) {
        super(HttpStatus.BAD_REQUEST, "INVALID_INPUT", message);
    }
}
