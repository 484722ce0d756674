package com.twosome.backend.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public class PartnerLeftEvent {

    private final Long coupleId;
    private final Long leftUserId;
    // null when nobody is left to notify
    private final Long remainingUserId;
    // true when the couple was deleted rather than left waiting for a new partner
    private final boolean coupleDissolved;
}
