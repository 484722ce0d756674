package com.twosome.backend.exception;

import org.springframework.http.HttpStatus;

public class ForbiddenException extends CoupleApiException {

    public ForbiddenException(String message) {
        super(HttpStatus.FORBIDDEN, "FORBIDDEN", message);
    }
}
