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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("CoupleInvitationService")
class CoupleInvitationServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 15, 10, 0);
    private static final LocalDate ANNIVERSARY = LocalDate.of(2020, 1, 1);

    @Mock
    private CoupleInvitationRepository invitationRepository;

    @Mock
    private UserService userService;

    @Mock
    private CoupleService coupleService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private CoupleInvitationService invitationService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC);
        invitationService = new CoupleInvitationService(invitationRepository, userService, coupleService,
                new PairingProperties(), eventPublisher, clock);
    }

    private static User user(Long id, Long coupleId) {
        User user = new User();
        user.setId(id);
        user.setName("user" + id);
        user.setEmail("user" + id + "@example.com");
        user.setCoupleId(coupleId);
        return user;
    }

    private static CoupleInvitation invitation(Long id, Long senderId, Long receiverId, LocalDateTime expiresAt) {
        CoupleInvitation invitation = CoupleInvitation.pending(senderId, receiverId, ANNIVERSARY, null,
                expiresAt.minusDays(7), expiresAt);
        invitation.setId(id);
        return invitation;
    }

    @Test
    @DisplayName("send: unknown receiver email is not found")
    void sendToUnknownEmail() {
        given(userService.findIdByEmail("nobody@example.com")).willReturn(Optional.empty());

        assertThatThrownBy(() -> invitationService.send(1L, "nobody@example.com", ANNIVERSARY, null))
                .isInstanceOf(NotFoundException.class);
        verify(invitationRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("send: inviting yourself is invalid")
    void sendToSelf() {
        given(userService.findIdByEmail("me@example.com")).willReturn(Optional.of(1L));

        assertThatThrownBy(() -> invitationService.send(1L, "me@example.com", ANNIVERSARY, null))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("send: a future anniversary is invalid")
    void sendWithFutureAnniversary() {
        LocalDate future = LocalDate.of(2030, 1, 1);
        willThrow(new InvalidInputException("Anniversary date cannot be in the future"))
                .given(coupleService).requireNotFuture(future);

        assertThatThrownBy(() -> invitationService.sendToAccount(1L, 2L, future, null))
                .isInstanceOf(InvalidInputException.class);
        verify(userService, never()).lockAll(anyCollection());
    }

    @Test
    @DisplayName("send: a message over 500 characters is invalid")
    void sendWithLongMessage() {
        assertThatThrownBy(() -> invitationService.sendToAccount(1L, 2L, ANNIVERSARY, "x".repeat(501)))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("send: a paired sender conflicts")
    void sendWhileSenderPaired() {
        given(userService.lockAll(List.of(1L, 2L))).willReturn(List.of(user(1L, 50L), user(2L, null)));

        assertThatThrownBy(() -> invitationService.sendToAccount(1L, 2L, ANNIVERSARY, null))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("already in a couple");
    }

    @Test
    @DisplayName("send: a paired receiver conflicts")
    void sendToPairedReceiver() {
        given(userService.lockAll(List.of(1L, 2L))).willReturn(List.of(user(1L, null), user(2L, 60L)));

        assertThatThrownBy(() -> invitationService.sendToAccount(1L, 2L, ANNIVERSARY, null))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("send: a pending invitation in the other direction conflicts")
    void sendDuplicateConflicts() {
        given(userService.lockAll(List.of(1L, 2L))).willReturn(List.of(user(1L, null), user(2L, null)));
        given(invitationRepository.findByPendingPairKey("1:2"))
                .willReturn(Optional.of(invitation(7L, 2L, 1L, NOW.plusDays(3))));

        assertThatThrownBy(() -> invitationService.sendToAccount(1L, 2L, ANNIVERSARY, null))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("pending invitation");
    }

    @Test
    @DisplayName("send: a lapsed pending invitation is retired and replaced")
    void sendReplacesLapsedInvitation() {
        CoupleInvitation lapsed = invitation(7L, 1L, 2L, NOW.minusMinutes(1));
        given(userService.lockAll(List.of(1L, 2L))).willReturn(List.of(user(1L, null), user(2L, null)));
        given(invitationRepository.findByPendingPairKey("1:2")).willReturn(Optional.of(lapsed));
        given(invitationRepository.saveAndFlush(any(CoupleInvitation.class))).willAnswer(inv -> inv.getArgument(0));

        CoupleInvitation sent = invitationService.sendToAccount(1L, 2L, ANNIVERSARY, null);

        assertThat(lapsed.getStatus()).isEqualTo(CoupleInvitation.Status.EXPIRED);
        assertThat(sent.isPending()).isTrue();
        assertThat(sent.getPendingPairKey()).isEqualTo("1:2");
    }

    @Test
    @DisplayName("send: creates a pending invitation lasting seven days and announces it")
    void sendCreatesInvitation() {
        given(userService.findIdByEmail("User2@Example.com")).willReturn(Optional.of(2L));
        given(userService.lockAll(List.of(1L, 2L))).willReturn(List.of(user(1L, null), user(2L, null)));
        given(invitationRepository.findByPendingPairKey("1:2")).willReturn(Optional.empty());
        given(invitationRepository.saveAndFlush(any(CoupleInvitation.class))).willAnswer(inv -> {
            CoupleInvitation saved = inv.getArgument(0);
            saved.setId(11L);
            return saved;
        });

        CoupleInvitation sent = invitationService.send(1L, "User2@Example.com", ANNIVERSARY, "  be mine  ");

        assertThat(sent.getSenderId()).isEqualTo(1L);
        assertThat(sent.getReceiverId()).isEqualTo(2L);
        assertThat(sent.getMessage()).isEqualTo("be mine");
        assertThat(sent.getExpiresAt()).isEqualTo(NOW.plusDays(7));

        ArgumentCaptor<InvitationSentEvent> event = ArgumentCaptor.forClass(InvitationSentEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().getInvitationId()).isEqualTo(11L);
        assertThat(event.getValue().getReceiverId()).isEqualTo(2L);
    }

    @Test
    @DisplayName("send: losing the insert race to a concurrent send is a conflict")
    void sendLosesInsertRace() {
        given(userService.lockAll(List.of(1L, 2L))).willReturn(List.of(user(1L, null), user(2L, null)));
        given(invitationRepository.findByPendingPairKey("1:2")).willReturn(Optional.empty());
        given(invitationRepository.saveAndFlush(any(CoupleInvitation.class)))
                .willThrow(new DataIntegrityViolationException("uk_couple_invitations_pending_pair"));

        assertThatThrownBy(() -> invitationService.sendToAccount(1L, 2L, ANNIVERSARY, null))
                .isInstanceOf(ConflictException.class);
        verify(eventPublisher, never()).publishEvent(any());
    }

    @Test
    @DisplayName("listReceived: sweeps overdue invitations before reading")
    void listReceivedSweepsFirst() {
        given(invitationRepository.findByReceiverIdAndStatusOrderByCreatedAtDescIdDesc(2L,
                CoupleInvitation.Status.PENDING)).willReturn(List.of());

        invitationService.listReceived(2L);

        InOrder order = inOrder(invitationRepository);
        order.verify(invitationRepository).expireOverdue(NOW, CoupleInvitation.Status.PENDING,
                CoupleInvitation.Status.EXPIRED);
        order.verify(invitationRepository).findByReceiverIdAndStatusOrderByCreatedAtDescIdDesc(2L,
                CoupleInvitation.Status.PENDING);
    }

    @Test
    @DisplayName("getForParticipant: outsiders are forbidden")
    void getForOutsider() {
        given(invitationRepository.findById(7L)).willReturn(Optional.of(invitation(7L, 1L, 2L, NOW.plusDays(1))));

        assertThatThrownBy(() -> invitationService.getForParticipant(7L, 3L))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("lockForAction: only the receiver may accept")
    void acceptBySender() {
        given(invitationRepository.findByIdForUpdate(7L)).willReturn(Optional.of(invitation(7L, 1L, 2L, NOW.plusDays(1))));

        assertThatThrownBy(() -> invitationService.lockForAction(7L, 1L, CoupleInvitation.Action.ACCEPT))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("lockForAction: only the sender may cancel")
    void cancelByReceiver() {
        given(invitationRepository.findByIdForUpdate(7L)).willReturn(Optional.of(invitation(7L, 1L, 2L, NOW.plusDays(1))));

        assertThatThrownBy(() -> invitationService.cancel(7L, 2L))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("lockForAction: an unknown invitation is not found")
    void unknownInvitation() {
        given(invitationRepository.findByIdForUpdate(7L)).willReturn(Optional.empty());

        assertThatThrownBy(() -> invitationService.reject(7L, 2L))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("lockForAction: an already answered invitation conflicts")
    void answeredInvitationConflicts() {
        CoupleInvitation accepted = invitation(7L, 1L, 2L, NOW.plusDays(1));
        accepted.markAccepted(NOW);
        given(invitationRepository.findByIdForUpdate(7L)).willReturn(Optional.of(accepted));

        assertThatThrownBy(() -> invitationService.lockForAction(7L, 2L, CoupleInvitation.Action.ACCEPT))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("accepted");
    }

    @Test
    @DisplayName("lockForAction: a lapsed invitation is flipped to expired and reported as expired")
    void lapsedInvitationExpires() {
        CoupleInvitation lapsed = invitation(7L, 1L, 2L, NOW.minusSeconds(1));
        given(invitationRepository.findByIdForUpdate(7L)).willReturn(Optional.of(lapsed));

        assertThatThrownBy(() -> invitationService.lockForAction(7L, 2L, CoupleInvitation.Action.ACCEPT))
                .isInstanceOf(InvitationExpiredException.class);
        assertThat(lapsed.getStatus()).isEqualTo(CoupleInvitation.Status.EXPIRED);
        assertThat(lapsed.getPendingPairKey()).isNull();
        assertThat(lapsed.getUpdatedAt()).isEqualTo(NOW);
        verify(invitationRepository).save(lapsed);
    }

    @Test
    @DisplayName("reject: the receiver rejects a pending invitation, stamped by the service clock")
    void rejectByReceiver() {
        CoupleInvitation pending = invitation(7L, 1L, 2L, NOW.plusDays(1));
        given(invitationRepository.findByIdForUpdate(7L)).willReturn(Optional.of(pending));
        given(invitationRepository.save(pending)).willReturn(pending);

        CoupleInvitation rejected = invitationService.reject(7L, 2L);

        assertThat(rejected.getStatus()).isEqualTo(CoupleInvitation.Status.REJECTED);
        assertThat(rejected.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("cancel: the sender's withdrawn invitation ends as expired")
    void cancelBySender() {
        CoupleInvitation pending = invitation(7L, 1L, 2L, NOW.plusDays(1));
        given(invitationRepository.findByIdForUpdate(7L)).willReturn(Optional.of(pending));
        given(invitationRepository.save(pending)).willReturn(pending);

        CoupleInvitation cancelled = invitationService.cancel(7L, 1L);

        assertThat(cancelled.getStatus()).isEqualTo(CoupleInvitation.Status.EXPIRED);
    }

    @Test
    @DisplayName("expirePendingInvolving: nothing to do without accounts")
    void expireInvolvingNobody() {
        assertThat(invitationService.expirePendingInvolving(List.of(), null)).isZero();
        verify(invitationRepository, never()).expirePendingInvolving(anyCollection(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("expirePendingInvolving: without an invitation to keep, nothing is excluded")
    void expireInvolvingWithoutExclusion() {
        given(invitationRepository.expirePendingInvolving(List.of(1L, 2L), -1L, NOW,
                CoupleInvitation.Status.PENDING, CoupleInvitation.Status.EXPIRED)).willReturn(3);

        assertThat(invitationService.expirePendingInvolving(List.of(1L, 2L), null)).isEqualTo(3);
    }
}
