package com.twosome.backend.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CoupleInvitation")
class CoupleInvitationTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 0);

    private CoupleInvitation pending(Long senderId, Long receiverId) {
        return CoupleInvitation.pending(senderId, receiverId, LocalDate.of(2020, 1, 1), "hi",
                NOW, NOW.plusDays(7));
    }

    @Test
    @DisplayName("pair key is the same in both directions")
    void pairKeyIsUnordered() {
        assertThat(CoupleInvitation.pairKey(7L, 3L)).isEqualTo("3:7");
        assertThat(CoupleInvitation.pairKey(3L, 7L)).isEqualTo("3:7");
    }

    @Test
    @DisplayName("a new invitation is pending and carries its pair key")
    void pendingInvitationHoldsPairKey() {
        CoupleInvitation invitation = pending(10L, 2L);

        assertThat(invitation.isPending()).isTrue();
        assertThat(invitation.getPendingPairKey()).isEqualTo("2:10");
        assertThat(invitation.getExpiresAt()).isEqualTo(NOW.plusDays(7));
    }

    @Test
    @DisplayName("an account cannot invite itself")
    void rejectsSelfInvitation() {
        assertThatThrownBy(() -> pending(4L, 4L))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("yourself");
    }

    @Test
    @DisplayName("every terminal transition releases the pair key")
    void terminalTransitionsClearPairKey() {
        CoupleInvitation accepted = pending(1L, 2L);
        accepted.markAccepted(NOW.plusHours(1));
        CoupleInvitation rejected = pending(1L, 2L);
        rejected.markRejected(NOW.plusHours(1));
        CoupleInvitation expired = pending(1L, 2L);
        expired.markExpired(NOW.plusHours(1));

        assertThat(accepted.getStatus()).isEqualTo(CoupleInvitation.Status.ACCEPTED);
        assertThat(rejected.getStatus()).isEqualTo(CoupleInvitation.Status.REJECTED);
        assertThat(expired.getStatus()).isEqualTo(CoupleInvitation.Status.EXPIRED);
        assertThat(accepted.getPendingPairKey()).isNull();
        assertThat(rejected.getPendingPairKey()).isNull();
        assertThat(expired.getPendingPairKey()).isNull();
    }

    @Test
    @DisplayName("a terminal status never changes again")
    void terminalStatusIsFinal() {
        CoupleInvitation invitation = pending(1L, 2L);
        invitation.markRejected(NOW.plusHours(1));

        assertThatThrownBy(() -> invitation.markAccepted(NOW.plusHours(2))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> invitation.markExpired(NOW.plusHours(2))).isInstanceOf(IllegalStateException.class);
        assertThat(invitation.getStatus()).isEqualTo(CoupleInvitation.Status.REJECTED);
        assertThat(invitation.getUpdatedAt()).isEqualTo(NOW.plusHours(1));
    }

    @Test
    @DisplayName("a terminal transition is stamped with the time it is given")
    void transitionStampsUpdatedAt() {
        CoupleInvitation invitation = pending(1L, 2L);

        invitation.markAccepted(NOW.plusDays(2));

        assertThat(invitation.getCreatedAt()).isEqualTo(NOW);
        assertThat(invitation.getUpdatedAt()).isEqualTo(NOW.plusDays(2));
    }

    @Test
    @DisplayName("expiry is reached at expiresAt, not after it")
    void expiryBoundary() {
        CoupleInvitation invitation = pending(1L, 2L);

        assertThat(invitation.isExpiredAt(NOW.plusDays(7).minusSeconds(1))).isFalse();
        assertThat(invitation.isExpiredAt(NOW.plusDays(7))).isTrue();
    }

    @Test
    @DisplayName("actions parse case-insensitively and reject unknown values")
    void actionParsing() {
        assertThat(CoupleInvitation.Action.from(" Accept ")).isEqualTo(CoupleInvitation.Action.ACCEPT);
        assertThat(CoupleInvitation.Action.from("cancel")).isEqualTo(CoupleInvitation.Action.CANCEL);
        assertThatThrownBy(() -> CoupleInvitation.Action.from("ignore"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CoupleInvitation.Action.from(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
