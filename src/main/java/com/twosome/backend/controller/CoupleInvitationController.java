package com.twosome.backend.controller;

import com.google.firebase.auth.FirebaseToken;
import com.twosome.backend.exception.InvalidInputException;
import com.twosome.backend.model.CoupleInvitation;
import com.twosome.backend.model.InvitationOutcome;
import com.twosome.backend.model.User;
import com.twosome.backend.service.CoupleInvitationService;
import com.twosome.backend.service.PairingService;
import com.twosome.backend.service.UserCache;
import com.twosome.backend.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/couples/invitations")
@RequiredArgsConstructor
public class CoupleInvitationController {

    private final CoupleInvitationService invitationService;
    private final PairingService pairingService;
    private final UserService userService;
    private final UserCache userCache;

    @PostMapping
    public ResponseEntity<?> sendInvitation(
            @AuthenticationPrincipal FirebaseToken principal,
            @RequestBody Map<String, Object> payload) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long senderId = userCache.getUserId(principal.getUid());

        LocalDate anniversaryDate = Payloads.requiredDate(payload, "anniversaryDate");
        String message = Payloads.optionalString(payload, "message");
        String receiverEmail = Payloads.optionalString(payload, "receiverEmail");
        Long receiverId = Payloads.optionalLong(payload, "receiverId");

        CoupleInvitation invitation;
        if (receiverEmail != null && !receiverEmail.isBlank()) {
            invitation = invitationService.send(senderId, receiverEmail, anniversaryDate, message);
        } else if (receiverId != null) {
            invitation = invitationService.sendToAccount(senderId, receiverId, anniversaryDate, message);
        } else {
            throw new InvalidInputException("receiverEmail or receiverId is required");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(invitation));
    }

    @GetMapping("/received")
    public ResponseEntity<?> getReceivedInvitations(@AuthenticationPrincipal FirebaseToken principal) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        return ResponseEntity.ok(toDtos(invitationService.listReceived(userId)));
    }

    @GetMapping("/sent")
    public ResponseEntity<?> getSentInvitations(@AuthenticationPrincipal FirebaseToken principal) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        return ResponseEntity.ok(toDtos(invitationService.listSent(userId)));
    }

    @GetMapping("/stats")
    public ResponseEntity<?> getInvitationStats(@AuthenticationPrincipal FirebaseToken principal) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Map<String, Long> stats = new HashMap<>();
        invitationService.getStats().forEach((status, count) -> stats.put(status.name().toLowerCase(), count));
        return ResponseEntity.ok(stats);
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getInvitation(
            @AuthenticationPrincipal FirebaseToken principal,
            @PathVariable Long id) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        return ResponseEntity.ok(toDto(invitationService.getForParticipant(id, userId)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<?> respondToInvitation(
            @AuthenticationPrincipal FirebaseToken principal,
            @PathVariable Long id,
            @RequestBody Map<String, Object> payload) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        CoupleInvitation.Action action = CoupleInvitation.Action.from(Payloads.optionalString(payload, "action"));

        InvitationOutcome outcome = pairingService.respond(id, userId, action);

        Map<String, Object> response = new HashMap<>();
        response.put("invitation", toDto(outcome.getInvitation()));
        if (outcome.getCouple() != null) {
            Map<Long, User> members = userService.getUsersByIds(outcome.getCouple().getMemberIds());
            response.put("couple", PairingResponses.couple(outcome.getCouple(), members));
        }
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> toDto(CoupleInvitation invitation) {
        return toDtos(List.of(invitation)).get(0);
    }

    private List<Map<String, Object>> toDtos(List<CoupleInvitation> invitations) {
        Set<Long> userIds = new HashSet<>();
        for (CoupleInvitation invitation : invitations) {
            userIds.add(invitation.getSenderId());
            userIds.add(invitation.getReceiverId());
        }
        return PairingResponses.invitations(invitations, userService.getUsersByIds(userIds));
    }
}
