package com.twosome.backend.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends CoupleApiException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, "NOT_FOUND", message);
    }
}
