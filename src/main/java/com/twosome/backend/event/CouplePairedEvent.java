package com.twosome.backend.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Published once a couple reaches two members, either by accepting an invitation or by joining with a code.
 */
@Getter
@RequiredArgsConstructor
public class CouplePairedEvent {

    public enum Source {
        INVITATION,
        PAIRING_CODE
    }

    private final Long coupleId;
    private final List<Long> memberIds;
    private final Source source;
}
