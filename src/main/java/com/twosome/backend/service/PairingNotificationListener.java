package com.twosome.backend.service;

import com.twosome.backend.event.CouplePairedEvent;
import com.twosome.backend.event.InvitationSentEvent;
import com.twosome.backend.event.PartnerLeftEvent;
import com.twosome.backend.model.User;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.Map;

/**
 * Turns committed pairing changes into pushes. Runs after commit on the async executor, so a slow or
 * failing push never holds a row lock or undoes a pairing.
 */
@Component
@RequiredArgsConstructor
public class PairingNotificationListener {

    private static final Logger log = LoggerFactory.getLogger(PairingNotificationListener.class);

    private final UserService userService;
    private final NotificationService notificationService;

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onInvitationSent(InvitationSentEvent event) {
        User sender = userService.findById(event.getSenderId()).orElse(null);
        User receiver = userService.findById(event.getReceiverId()).orElse(null);
        if (sender == null || receiver == null) {
            log.debug("Skipping invitation push for invitation {}: account gone", event.getInvitationId());
            return;
        }
        notificationService.sendNotification(receiver.getFcmToken(),
                "New couple invitation",
                sender.getName() + " wants to pair with you",
                Map.of("type", "COUPLE_INVITATION",
                        "invitationId", String.valueOf(event.getInvitationId()),
                        "senderId", String.valueOf(event.getSenderId())));
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onCouplePaired(CouplePairedEvent event) {
        Map<Long, User> members = userService.getUsersByIds(event.getMemberIds());
        for (User member : members.values()) {
            User partner = members.values().stream()
                    .filter(u -> !u.getId().equals(member.getId()))
                    .findFirst()
                    .orElse(null);
            String partnerName = partner != null ? partner.getName() : "your partner";
            notificationService.sendNotification(member.getFcmToken(),
                    "You are now a couple",
                    "You and " + partnerName + " are paired",
                    Map.of("type", "COUPLE_PAIRED",
                            "coupleId", String.valueOf(event.getCoupleId()),
                            "source", event.getSource().name()));
        }
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPartnerLeft(PartnerLeftEvent event) {
        if (event.getRemainingUserId() == null) {
            return;
        }
        userService.findById(event.getRemainingUserId()).ifPresent(remaining ->
                notificationService.sendNotification(remaining.getFcmToken(),
                        event.isCoupleDissolved() ? "Your couple was dissolved" : "Your partner left",
                        event.isCoupleDissolved()
                                ? "Your partner ended the couple"
                                : "Your couple is waiting for a new partner",
                        Map.of("type", "PARTNER_LEFT",
                                "coupleId", String.valueOf(event.getCoupleId()))));
    }
}
