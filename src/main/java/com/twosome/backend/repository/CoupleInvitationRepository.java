package com.twosome.backend.repository;

import com.twosome.backend.model.CoupleInvitation;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CoupleInvitationRepository extends JpaRepository<CoupleInvitation, Long> {

    /**
     * Closed projection of the two parties; reading it does not attach an invitation entity.
     */
    interface Participants {
        Long getSenderId();

        Long getReceiverId();
    }

    Optional<Participants> findParticipantsById(Long id);

    Optional<CoupleInvitation> findByPendingPairKey(String pendingPairKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM CoupleInvitation i WHERE i.id = :id")
    Optional<CoupleInvitation> findByIdForUpdate(@Param("id") Long id);

    List<CoupleInvitation> findByReceiverIdAndStatusOrderByCreatedAtDescIdDesc(
            Long receiverId, CoupleInvitation.Status status);

    List<CoupleInvitation> findBySenderIdAndStatusOrderByCreatedAtDescIdDesc(
            Long senderId, CoupleInvitation.Status status);

    long countByStatus(CoupleInvitation.Status status);

    @Modifying(flushAutomatically = true)
    @Query("""
            UPDATE CoupleInvitation i
            SET i.status = :expired, i.pendingPairKey = NULL, i.updatedAt = :now
            WHERE i.status = :pending AND i.expiresAt < :now
            """)
    int expireOverdue(@Param("now") LocalDateTime now,
            @Param("pending") CoupleInvitation.Status pending,
            @Param("expired") CoupleInvitation.Status expired);

    @Modifying(flushAutomatically = true)
    @Query("""
            UPDATE CoupleInvitation i
            SET i.status = :expired, i.pendingPairKey = NULL, i.updatedAt = :now
            WHERE i.status = :pending
              AND i.id <> :excludedId
              AND (i.senderId IN :userIds OR i.receiverId IN :userIds)
            """)
    int expirePendingInvolving(@Param("userIds") Collection<Long> userIds,
            @Param("excludedId") Long excludedId,
            @Param("now") LocalDateTime now,
            @Param("pending") CoupleInvitation.Status pending,
            @Param("expired") CoupleInvitation.Status expired);
}
