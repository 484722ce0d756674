package com.twosome.backend.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public class InvitationSentEvent {

    private final Long invitationId;
    private final Long senderId;
    private final Long receiverId;
}
