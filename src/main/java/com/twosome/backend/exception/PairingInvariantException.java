package com.twosome.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Fatal: the account/couple membership invariant could not be guaranteed, or pairing-code
 * generation ran out of attempts. Never shown to callers in detail.
 */
public class PairingInvariantException extends CoupleApiException {

    public PairingInvariantException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "FATAL", message);
    }
}
