package com.twosome.backend.service;

import com.twosome.backend.config.PairingProperties;
import com.twosome.backend.event.InvitationSentEvent;
import com.twosome.backend.exception.ConflictException;
import com.twosome.backend.exception.ForbiddenException;
import com.twosome.backend.exception.InvalidInputException;
import com.twosome.backend.exception.InvitationExpiredException;
import com.twosome.backend.exception.NotFoundException;
import com.twosome.backend.model.CoupleInvitation;
import com.twosome.backend.model.User;
import com.twosome.backend.repository.CoupleInvitationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Invitation ledger: creation, listing and the terminal transitions that do not form a couple.
 * Accepting is driven by {@link PairingService}, which calls back into {@link #lockForAction} and
 * {@link #markAccepted}.
 */
@Service
@RequiredArgsConstructor
public class CoupleInvitationService {

    private static final Logger log = LoggerFactory.getLogger(CoupleInvitationService.class);
    private static final long NO_EXCLUDED_INVITATION = -1L;

    private final CoupleInvitationRepository invitationRepository;
    private final UserService userService;
    private final CoupleService coupleService;
    private final PairingProperties pairingProperties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public CoupleInvitation send(Long senderId, String receiverEmail, LocalDate anniversaryDate, String message) {
        validate(anniversaryDate, message);
        if (receiverEmail == null || receiverEmail.isBlank()) {
            throw new InvalidInputException("Receiver email is required");
        }

        Long receiverId = userService.findIdByEmail(receiverEmail)
                .orElseThrow(() -> new NotFoundException("User with this email not found"));
        return createInvitation(senderId, receiverId, anniversaryDate, message);
    }

    @Transactional
    public CoupleInvitation sendToAccount(Long senderId, Long receiverId, LocalDate anniversaryDate, String message) {
        validate(anniversaryDate, message);
        if (receiverId == null) {
            throw new InvalidInputException("Receiver is required");
        }
        return createInvitation(senderId, receiverId, anniversaryDate, message);
    }

    private CoupleInvitation createInvitation(Long senderId, Long receiverId, LocalDate anniversaryDate,
            String message) {
        if (senderId.equals(receiverId)) {
            throw new InvalidInputException("Cannot send invitation to yourself");
        }

        // Both accounts stay locked until commit so a concurrent pairing cannot slip in between check and insert
        List<User> parties = userService.lockAll(List.of(senderId, receiverId));
        User sender = findLocked(parties, senderId, "Sender not found");
        User receiver = findLocked(parties, receiverId, "Receiver not found");

        if (sender.isInCouple()) {
            throw new ConflictException("You are already in a couple");
        }
        if (receiver.isInCouple()) {
            throw new ConflictException("The receiver is already in a couple");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<CoupleInvitation> existing =
                invitationRepository.findByPendingPairKey(CoupleInvitation.pairKey(senderId, receiverId));
        if (existing.isPresent()) {
            CoupleInvitation previous = existing.get();
            if (!previous.isExpiredAt(now)) {
                throw new ConflictException("A pending invitation already exists between you and this user");
            }
            // Lapsed but not yet swept: retire it so the pair key is free again
            previous.markExpired(now);
            invitationRepository.saveAndFlush(previous);
        }

        CoupleInvitation invitation = CoupleInvitation.pending(senderId, receiverId, anniversaryDate,
                trimToNull(message), now, now.plus(pairingProperties.getInvitationTtl()));
        CoupleInvitation saved;
        try {
            saved = invitationRepository.saveAndFlush(invitation);
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent invitation between users {} and {} lost the race", senderId, receiverId);
            throw new ConflictException("A pending invitation already exists between you and this user", e);
        }

        log.info("Invitation {} sent from user {} to user {}", saved.getId(), senderId, receiverId);
        eventPublisher.publishEvent(new InvitationSentEvent(saved.getId(), senderId, receiverId));
        return saved;
    }

    @Transactional
    public List<CoupleInvitation> listReceived(Long accountId) {
        expireOverdue();
        return invitationRepository.findByReceiverIdAndStatusOrderByCreatedAtDescIdDesc(
                accountId, CoupleInvitation.Status.PENDING);
    }

    @Transactional
    public List<CoupleInvitation> listSent(Long accountId) {
        expireOverdue();
        return invitationRepository.findBySenderIdAndStatusOrderByCreatedAtDescIdDesc(
                accountId, CoupleInvitation.Status.PENDING);
    }

    /**
     * Any status is visible, but only to the sender and the receiver.
     */
    @Transactional
    public CoupleInvitation getForParticipant(Long invitationId, Long accountId) {
        expireOverdue();
        CoupleInvitation invitation = invitationRepository.findById(invitationId)
                .orElseThrow(() -> new NotFoundException("Invitation not found"));
        if (!invitation.involves(accountId)) {
            throw new ForbiddenException("You can only view invitations you sent or received");
        }
        return invitation;
    }

    public CoupleInvitationRepository.Participants getParticipants(Long invitationId) {
        return invitationRepository.findParticipantsById(invitationId)
                .orElseThrow(() -> new NotFoundException("Invitation not found"));
    }

    @Transactional(noRollbackFor = InvitationExpiredException.class)
    public CoupleInvitation reject(Long invitationId, Long actorId) {
        CoupleInvitation invitation = lockForAction(invitationId, actorId, CoupleInvitation.Action.REJECT);
        invitation.markRejected(LocalDateTime.now(clock));
        CoupleInvitation saved = invitationRepository.save(invitation);
        log.info("Invitation {} rejected by user {}", invitationId, actorId);
        return saved;
    }

    /**
     * Withdraws a pending invitation. There is no separate cancelled status, so it ends as EXPIRED.
     */
    @Transactional(noRollbackFor = InvitationExpiredException.class)
    public CoupleInvitation cancel(Long invitationId, Long actorId) {
        CoupleInvitation invitation = lockForAction(invitationId, actorId, CoupleInvitation.Action.CANCEL);
        invitation.markExpired(LocalDateTime.now(clock));
        CoupleInvitation saved = invitationRepository.save(invitation);
        log.info("Invitation {} cancelled by user {}", invitationId, actorId);
        return saved;
    }

    /**
     * Locks the invitation row and checks that {@code actorId} may apply {@code action} to it now.
     * A lapsed invitation is flipped to EXPIRED before {@link InvitationExpiredException} is thrown.
     */
    @Transactional(noRollbackFor = InvitationExpiredException.class)
    public CoupleInvitation lockForAction(Long invitationId, Long actorId, CoupleInvitation.Action action) {
        CoupleInvitation invitation = invitationRepository.findByIdForUpdate(invitationId)
                .orElseThrow(() -> new NotFoundException("Invitation not found"));

        if (action == CoupleInvitation.Action.CANCEL) {
            if (!invitation.getSenderId().equals(actorId)) {
                throw new ForbiddenException("Only the sender can cancel this invitation");
            }
        } else if (!invitation.getReceiverId().equals(actorId)) {
            throw new ForbiddenException("Only the receiver can " + action.name().toLowerCase() + " this invitation");
        }

        if (invitation.getStatus() == CoupleInvitation.Status.EXPIRED) {
            throw new InvitationExpiredException(invitationId);
        }
        if (!invitation.isPending()) {
            throw new ConflictException("Invitation is already " + invitation.getStatus().name().toLowerCase());
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (invitation.isExpiredAt(now)) {
            invitation.markExpired(now);
            invitationRepository.save(invitation);
            log.warn("User {} tried to {} lapsed invitation {}", actorId, action.name().toLowerCase(), invitationId);
            throw new InvitationExpiredException(invitationId);
        }
        return invitation;
    }

    @Transactional
    public CoupleInvitation markAccepted(CoupleInvitation invitation) {
        invitation.markAccepted(LocalDateTime.now(clock));
        return invitationRepository.saveAndFlush(invitation);
    }

    /**
     * Expires every other pending invitation that involves one of the given accounts.
     */
    @Transactional
    public int expirePendingInvolving(Collection<Long> accountIds, Long excludedInvitationId) {
        if (accountIds.isEmpty()) {
            return 0;
        }
        int expired = invitationRepository.expirePendingInvolving(accountIds,
                excludedInvitationId != null ? excludedInvitationId : NO_EXCLUDED_INVITATION,
                LocalDateTime.now(clock),
                CoupleInvitation.Status.PENDING,
                CoupleInvitation.Status.EXPIRED);
        if (expired > 0) {
            log.info("Expired {} pending invitation(s) involving users {}", expired, accountIds);
        }
        return expired;
    }

    /**
     * Idempotent sweep of pending invitations whose expiry has passed.
     */
    @Transactional
    public int expireOverdue() {
        int expired = invitationRepository.expireOverdue(LocalDateTime.now(clock),
                CoupleInvitation.Status.PENDING,
                CoupleInvitation.Status.EXPIRED);
        if (expired > 0) {
            log.debug("Expiry sweep flipped {} invitation(s)", expired);
        }
        return expired;
    }

    @Transactional
    public Map<CoupleInvitation.Status, Long> getStats() {
        expireOverdue();
        Map<CoupleInvitation.Status, Long> stats = new EnumMap<>(CoupleInvitation.Status.class);
        for (CoupleInvitation.Status status : CoupleInvitation.Status.values()) {
            stats.put(status, invitationRepository.countByStatus(status));
        }
        return stats;
    }

    private void validate(LocalDate anniversaryDate, String message) {
        coupleService.requireNotFuture(anniversaryDate);
        if (message != null && message.length() > CoupleInvitation.MAX_MESSAGE_LENGTH) {
            throw new InvalidInputException(
                    "Message cannot exceed " + CoupleInvitation.MAX_MESSAGE_LENGTH + " characters");
        }
    }

    private static User findLocked(List<User> users, Long id, String notFoundMessage) {
        return users.stream()
                .filter(u -> u.getId().equals(id) && !u.isDeleted())
                .findFirst()
                .orElseThrow(() -> new NotFoundException(notFoundMessage));
    }

    private static String trimToNull(String message) {
        if (message == null) {
            return null;
        }
        String trimmed = message.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
