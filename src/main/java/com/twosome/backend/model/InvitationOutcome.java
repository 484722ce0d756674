package com.twosome.backend.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of responding to an invitation. {@code couple} is only set when the invitation was accepted.
 */
@Getter
@RequiredArgsConstructor
public class InvitationOutcome {

    private final CoupleInvitation invitation;
    private final Couple couple;
}
