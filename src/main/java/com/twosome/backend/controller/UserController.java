package com.twosome.backend.controller;

import com.google.firebase.auth.FirebaseToken;
import com.twosome.backend.model.User;
import com.twosome.backend.service.PairingService;
import com.twosome.backend.service.UserCache;
import com.twosome.backend.service.UserService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private static final Logger log = LoggerFactory.getLogger(UserController.class);

    private final UserService userService;
    private final PairingService pairingService;
    private final UserCache userCache;

    // Creates the account on the first call after sign-in
    @GetMapping("/me")
    public ResponseEntity<?> getCurrentUser(@AuthenticationPrincipal FirebaseToken principal) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        User user = userService.createUserIfNew(
                principal.getUid(),
                principal.getEmail(),
                principal.getName(),
                principal.getPicture());
        return ResponseEntity.ok(PairingResponses.currentUser(user));
    }

    @PutMapping("/me/fcm-token")
    public ResponseEntity<?> updateFcmToken(
            @AuthenticationPrincipal FirebaseToken principal,
            @RequestBody Map<String, Object> payload) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        userService.updateFcmToken(userId, Payloads.requiredString(payload, "token"));
        return ResponseEntity.ok().build();
    }

    @DeleteMapping("/me")
    public ResponseEntity<?> deleteAccount(@AuthenticationPrincipal FirebaseToken principal) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        log.info("Account deletion requested for user {}", userId);
        pairingService.deleteAccount(userId);
        return ResponseEntity.noContent().build();
    }
}
