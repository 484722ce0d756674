package com.twosome.backend.service;

import com.twosome.backend.event.CouplePairedEvent;
import com.twosome.backend.event.PartnerLeftEvent;
import com.twosome.backend.exception.ConflictException;
import com.twosome.backend.exception.ForbiddenException;
import com.twosome.backend.exception.InvalidInputException;
import com.twosome.backend.exception.InvitationExpiredException;
import com.twosome.backend.exception.NotFoundException;
import com.twosome.backend.exception.PairingInvariantException;
import com.twosome.backend.model.Couple;
import com.twosome.backend.model.CoupleInvitation;
import com.twosome.backend.model.InvitationOutcome;
import com.twosome.backend.model.User;
import com.twosome.backend.repository.CoupleInvitationRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Coordinates accounts, couples and invitations so that an account points at a couple exactly when
 * that couple lists the account. Every protocol runs in one transaction and takes its row locks in the
 * same order: accounts by ascending id, then the invitation, then the couple.
 */
@Service
@RequiredArgsConstructor
public class PairingService {

    private static final Logger log = LoggerFactory.getLogger(PairingService.class);

    private final UserService userService;
    private final CoupleService coupleService;
    private final CoupleInvitationService invitationService;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional(noRollbackFor = InvitationExpiredException.class)
    public InvitationOutcome respond(Long invitationId, Long actorId, CoupleInvitation.Action action) {
        switch (action) {
            case ACCEPT:
                return pairFromInvitation(invitationId, actorId);
            case REJECT:
                return new InvitationOutcome(invitationService.reject(invitationId, actorId), null);
            case CANCEL:
                return new InvitationOutcome(invitationService.cancel(invitationId, actorId), null);
            default:
                throw new InvalidInputException("Unsupported action: " + action);
        }
    }

    /**
     * Forms a couple from a pending invitation. Retrying with the same invitation after success fails
     * with a conflict because both parties are already paired.
     */
    @Transactional(noRollbackFor = InvitationExpiredException.class)
    public Couple acceptInvitation(Long invitationId, Long actorId) {
        return pairFromInvitation(invitationId, actorId).getCouple();
    }

    // Returns the invitation row locked here; no other invitation rows are read after the locks are taken.
    private InvitationOutcome pairFromInvitation(Long invitationId, Long actorId) {
        CoupleInvitationRepository.Participants participants = invitationService.getParticipants(invitationId);
        if (!participants.getReceiverId().equals(actorId)) {
            throw new ForbiddenException("Only the receiver can accept this invitation");
        }
        Long senderId = participants.getSenderId();
        Long receiverId = participants.getReceiverId();

        List<User> parties = userService.lockAll(List.of(senderId, receiverId));
        User sender = requireLive(parties, senderId, "Sender no longer exists");
        User receiver = requireLive(parties, receiverId, "User not found");
        if (receiver.isInCouple()) {
            log.warn("User {} tried to accept invitation {} while already in couple {}",
                    receiverId, invitationId, receiver.getCoupleId());
            throw new ConflictException("You are already in a couple");
        }
        if (sender.isInCouple()) {
            log.warn("Invitation {} accepted after its sender {} paired elsewhere", invitationId, senderId);
            throw new ConflictException("The sender is already in a couple");
        }

        CoupleInvitation invitation = invitationService.lockForAction(
                invitationId, actorId, CoupleInvitation.Action.ACCEPT);

        Couple couple = coupleService.create(senderId, receiverId, invitation.getAnniversaryDate());
        userService.setCoupleRef(sender, couple.getId());
        userService.setCoupleRef(receiver, couple.getId());
        invitationService.markAccepted(invitation);
        invitationService.expirePendingInvolving(List.of(senderId, receiverId), invitationId);

        verifyMembership(couple.getId());
        log.info("Couple {} formed from invitation {} by users {} and {}",
                couple.getId(), invitationId, senderId, receiverId);
        eventPublisher.publishEvent(new CouplePairedEvent(couple.getId(),
                List.of(senderId, receiverId), CouplePairedEvent.Source.INVITATION));
        return new InvitationOutcome(invitation, couple);
    }

    @Transactional
    public Couple joinByCode(Long accountId, String pairingCode) {
        String code = PairingCodeGenerator.normalize(pairingCode);
        if (code == null) {
            throw new InvalidInputException("Pairing code must be 8 letters or digits");
        }

        User joiner = userService.lockUser(accountId);
        if (joiner.isInCouple()) {
            throw new ConflictException("You are already in a couple");
        }

        Couple couple = coupleService.lockByPairingCode(code)
                .orElseThrow(() -> new NotFoundException("Invalid pairing code"));
        if (couple.hasMember(accountId)) {
            throw new ConflictException("You are already a member of this couple");
        }
        if (couple.isComplete()) {
            log.warn("User {} tried to join complete couple {}", accountId, couple.getId());
            throw new ConflictException("Couple already complete");
        }
        if (couple.getStatus() == Couple.Status.BLOCKED || couple.getStatus() == Couple.Status.INACTIVE) {
            throw new ConflictException("This couple is not accepting a partner");
        }

        coupleService.addMember(couple, accountId);
        userService.setCoupleRef(joiner, couple.getId());
        invitationService.expirePendingInvolving(new ArrayList<>(couple.getMemberIds()), null);

        verifyMembership(couple.getId());
        log.info("User {} joined couple {} with its pairing code", accountId, couple.getId());
        eventPublisher.publishEvent(new CouplePairedEvent(couple.getId(),
                new ArrayList<>(couple.getMemberIds()), CouplePairedEvent.Source.PAIRING_CODE));
        return couple;
    }

    /**
     * Starts a one-member couple whose pairing code a partner can then use with {@link #joinByCode}.
     */
    @Transactional
    public Couple openCouple(Long accountId, LocalDate anniversaryDate) {
        coupleService.requireNotFuture(anniversaryDate);

        User user = userService.lockUser(accountId);
        if (user.isInCouple()) {
            throw new ConflictException("You are already in a couple");
        }

        Couple couple = coupleService.openPlaceholder(accountId, anniversaryDate);
        userService.setCoupleRef(user, couple.getId());
        invitationService.expirePendingInvolving(List.of(accountId), null);

        verifyMembership(couple.getId());
        log.info("User {} opened couple {} and is waiting for a partner", accountId, couple.getId());
        return couple;
    }

    /**
     * The partner, if any, stays in the couple alone and can be joined again with its pairing code.
     */
    @Transactional
    public void leaveCouple(Long accountId) {
        User user = userService.lockUser(accountId);
        if (!user.isInCouple()) {
            throw new NotFoundException("You are not in a couple");
        }
        detach(user);
    }

    /**
     * Dissolves a couple for both members. Any member may do this.
     */
    @Transactional
    public void deleteCouple(Long coupleId, Long accountId) {
        List<Long> memberIds = coupleService.findMemberIds(coupleId);
        if (memberIds.isEmpty()) {
            throw new NotFoundException("Couple not found");
        }
        if (!memberIds.contains(accountId)) {
            throw new ForbiddenException("You are not a member of this couple");
        }

        List<User> members = userService.lockAll(memberIds);
        Couple couple = coupleService.lockById(coupleId);
        if (!couple.hasMember(accountId)) {
            throw new ForbiddenException("You are not a member of this couple");
        }
        if (!new HashSet<>(memberIds).equals(couple.getMemberIds())) {
            throw new ConflictException("The couple changed while it was being deleted. Please retry.");
        }

        for (User member : members) {
            if (Objects.equals(member.getCoupleId(), coupleId)) {
                userService.setCoupleRef(member, null);
            }
        }
        coupleService.delete(couple);

        if (!userService.findIdsPointingTo(coupleId).isEmpty()) {
            throw new PairingInvariantException("Accounts still point at deleted couple " + coupleId);
        }
        log.info("Couple {} deleted by user {}", coupleId, accountId);
        for (Long memberId : memberIds) {
            if (!memberId.equals(accountId)) {
                eventPublisher.publishEvent(new PartnerLeftEvent(coupleId, accountId, memberId, true));
            }
        }
    }

    /**
     * Removes the account from its couple and from every pending invitation before the account itself
     * is soft-deleted.
     */
    @Transactional
    public void deleteAccount(Long accountId) {
        User user = userService.lockUser(accountId);
        if (user.isInCouple()) {
            detach(user);
        }
        invitationService.expirePendingInvolving(List.of(accountId), null);
        userService.markDeleted(user);
        log.info("Account {} deleted and detached from pairing", accountId);
    }

    private void detach(User user) {
        Long userId = user.getId();
        Long coupleId = user.getCoupleId();

        Couple couple = coupleService.tryLock(coupleId).orElse(null);
        if (couple == null || !couple.hasMember(userId)) {
            log.warn("User {} pointed at couple {} which does not list them; clearing the pointer", userId, coupleId);
            userService.setCoupleRef(user, null);
            return;
        }

        userService.setCoupleRef(user, null);
        boolean stillExists = coupleService.removeMember(couple, userId);
        Long remainingId = stillExists ? couple.getMemberIds().iterator().next() : null;

        if (stillExists) {
            verifyMembership(coupleId);
            log.info("User {} left couple {}; user {} remains", userId, coupleId, remainingId);
        } else {
            log.info("User {} left couple {}, which had no other member and was deleted", userId, coupleId);
        }
        eventPublisher.publishEvent(new PartnerLeftEvent(coupleId, userId, remainingId, !stillExists));
    }

    /**
     * Compares the couple's member list with the accounts pointing at it, as stored. A mismatch rolls the
     * whole protocol back.
     */
    private void verifyMembership(Long coupleId) {
        Set<Long> listed = new HashSet<>(coupleService.findMemberIds(coupleId));
        Set<Long> pointing = userService.findIdsPointingTo(coupleId);
        if (!listed.equals(pointing) || listed.isEmpty() || listed.size() > Couple.MAX_MEMBERS) {
            throw new PairingInvariantException("Couple " + coupleId + " lists members " + listed
                    + " but is referenced by accounts " + pointing);
        }
    }

    private static User requireLive(List<User> users, Long id, String notFoundMessage) {
        return users.stream()
                .filter(u -> u.getId().equals(id) && !u.isDeleted())
                .findFirst()
                .orElseThrow(() -> new NotFoundException(notFoundMessage));
    }
}
