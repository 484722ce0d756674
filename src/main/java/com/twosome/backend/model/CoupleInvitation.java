package com.twosome.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;

@Entity
@Table(name = "couple_invitations", indexes = {
        @Index(name = "idx_couple_invitations_receiver_status", columnList = "receiver_id,status"),
        @Index(name = "idx_couple_invitations_sender_status", columnList = "sender_id,status"),
        @Index(name = "idx_couple_invitations_expires_at", columnList = "expires_at")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_couple_invitations_pending_pair", columnNames = "pending_pair_key")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CoupleInvitation {

    public enum Status {
        PENDING,
        ACCEPTED,
        REJECTED,
        EXPIRED;

        public boolean isTerminal() {
            return this != PENDING;
        }
    }

    public enum Action {
        ACCEPT,
        REJECT,
        CANCEL;

        public static Action from(String value) {
            if (value == null) {
                throw new IllegalArgumentException("Action is required");
            }
            try {
                return Action.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Invalid action. Must be \"accept\", \"reject\", or \"cancel\"");
            }
        }
    }

    public static final int MAX_MESSAGE_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "sender_id", nullable = false)
    private Long senderId;

    @Column(name = "receiver_id", nullable = false)
    private Long receiverId;

    @Column(name = "anniversary_date", nullable = false)
    private LocalDate anniversaryDate;

    @Column(length = MAX_MESSAGE_LENGTH)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.PENDING;

    // "<minId>:<maxId>" while pending, null once terminal.
    @Column(name = "pending_pair_key", length = 64)
    private String pendingPairKey;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static CoupleInvitation pending(Long senderId, Long receiverId, LocalDate anniversaryDate,
            String message, LocalDateTime now, LocalDateTime expiresAt) {
        if (senderId == null || receiverId == null) {
            throw new IllegalArgumentException("Sender and receiver are required");
        }
        if (senderId.equals(receiverId)) {
            throw new IllegalArgumentException("Cannot send invitation to yourself");
        }
        return CoupleInvitation.builder()
                .senderId(senderId)
                .receiverId(receiverId)
                .anniversaryDate(anniversaryDate)
                .message(message)
                .status(Status.PENDING)
                .pendingPairKey(pairKey(senderId, receiverId))
                .createdAt(now)
                .updatedAt(now)
                .expiresAt(expiresAt)
                .build();
    }

    public static String pairKey(Long userA, Long userB) {
        long low = Math.min(userA, userB);
        long high = Math.max(userA, userB);
        return low + ":" + high;
    }

    public boolean isPending() {
        return status == Status.PENDING;
    }

    public boolean isExpiredAt(LocalDateTime now) {
        return status == Status.EXPIRED || !expiresAt.isAfter(now);
    }

    public boolean involves(Long userId) {
        return senderId.equals(userId) || receiverId.equals(userId);
    }

    // Terminal transitions are stamped by the caller's clock, like the bulk expiry updates.
    public void markAccepted(LocalDateTime now) {
        transitionTo(Status.ACCEPTED, now);
    }

    public void markRejected(LocalDateTime now) {
        transitionTo(Status.REJECTED, now);
    }

    public void markExpired(LocalDateTime now) {
        transitionTo(Status.EXPIRED, now);
    }

    private void transitionTo(Status target, LocalDateTime now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Invitation " + id + " is already " + status);
        }
        status = target;
        pendingPairKey = null;
        updatedAt = now;
    }
}
