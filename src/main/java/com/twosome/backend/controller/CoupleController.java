package com.twosome.backend.controller;

import com.google.firebase.auth.FirebaseToken;
import com.twosome.backend.model.Couple;
import com.twosome.backend.model.User;
import com.twosome.backend.service.CoupleService;
import com.twosome.backend.service.PairingService;
import com.twosome.backend.service.UserCache;
import com.twosome.backend.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Map;

@RestController
@RequestMapping("/api/couples")
@RequiredArgsConstructor
public class CoupleController {

    private final CoupleService coupleService;
    private final PairingService pairingService;
    private final UserService userService;
    private final UserCache userCache;

    // Opens a couple with one member; the partner joins with the returned pairing code
    @PostMapping
    public ResponseEntity<?> openCouple(
            @AuthenticationPrincipal FirebaseToken principal,
            @RequestBody Map<String, Object> payload) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        LocalDate anniversaryDate = Payloads.requiredDate(payload, "anniversaryDate");
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(pairingService.openCouple(userId, anniversaryDate)));
    }

    @PostMapping("/join")
    public ResponseEntity<?> joinByCode(
            @AuthenticationPrincipal FirebaseToken principal,
            @RequestBody Map<String, Object> payload) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        String pairingCode = Payloads.requiredString(payload, "pairingCode");
        return ResponseEntity.ok(toDto(pairingService.joinByCode(userId, pairingCode)));
    }

    @GetMapping("/me")
    public ResponseEntity<?> getMyCouple(@AuthenticationPrincipal FirebaseToken principal) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        return ResponseEntity.ok(toDto(coupleService.getByMember(userId)));
    }

    @GetMapping("/partner")
    public ResponseEntity<?> getPartner(@AuthenticationPrincipal FirebaseToken principal) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        return ResponseEntity.ok(PairingResponses.userSummary(coupleService.getPartner(userId)));
    }

    @GetMapping("/stats")
    public ResponseEntity<?> getStats(@AuthenticationPrincipal FirebaseToken principal) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        return ResponseEntity.ok(PairingResponses.stats(coupleService.getStats(userId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getCouple(
            @AuthenticationPrincipal FirebaseToken principal,
            @PathVariable Long id) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        return ResponseEntity.ok(toDto(coupleService.getForMember(id, userId)));
    }

    @PutMapping("/{id}/settings")
    public ResponseEntity<?> updateSettings(
            @AuthenticationPrincipal FirebaseToken principal,
            @PathVariable Long id,
            @RequestBody Map<String, Object> payload) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        Map<String, Object> settings = Payloads.requiredObject(payload, "settings");
        return ResponseEntity.ok(toDto(coupleService.updateSettings(id, userId, settings)));
    }

    @PutMapping("/{id}/anniversary")
    public ResponseEntity<?> updateAnniversary(
            @AuthenticationPrincipal FirebaseToken principal,
            @PathVariable Long id,
            @RequestBody Map<String, Object> payload) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        LocalDate anniversaryDate = Payloads.requiredDate(payload, "anniversaryDate");
        return ResponseEntity.ok(toDto(coupleService.updateAnniversaryDate(id, userId, anniversaryDate)));
    }

    @PostMapping("/{id}/pairing-code")
    public ResponseEntity<?> regeneratePairingCode(
            @AuthenticationPrincipal FirebaseToken principal,
            @PathVariable Long id) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        return ResponseEntity.ok(toDto(coupleService.regeneratePairingCode(id, userId)));
    }

    @DeleteMapping("/me")
    public ResponseEntity<?> leaveCouple(@AuthenticationPrincipal FirebaseToken principal) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        pairingService.leaveCouple(userId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteCouple(
            @AuthenticationPrincipal FirebaseToken principal,
            @PathVariable Long id) {
        if (principal == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        Long userId = userCache.getUserId(principal.getUid());
        pairingService.deleteCouple(id, userId);
        return ResponseEntity.noContent().build();
    }

    private Map<String, Object> toDto(Couple couple) {
        Map<Long, User> members = userService.getUsersByIds(couple.getMemberIds());
        return PairingResponses.couple(couple, members);
    }
}
