package com.twosome.backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Thrown after a lapsed invitation has been flipped to EXPIRED. Transactions that can raise it
 * declare {@code noRollbackFor} so the flip is committed.
 */
@Getter
public class InvitationExpiredException extends CoupleApiException {

    private final Long invitationId;

    public InvitationExpiredException(Long invitationId) {
        super(HttpStatus.GONE, "EXPIRED", "This invitation has expired");
        this.invitationId = invitationId;
    }
}
