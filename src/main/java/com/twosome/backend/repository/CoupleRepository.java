package com.twosome.backend.repository;

import com.twosome.backend.model.Couple;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface CoupleRepository extends JpaRepository<Couple, Long> {

    Optional<Couple> findByPairingCode(String pairingCode);

    boolean existsByPairingCode(String pairingCode);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Couple c WHERE c.id = :id")
    Optional<Couple> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Couple c WHERE c.pairingCode = :pairingCode")
    Optional<Couple> findByPairingCodeForUpdate(@Param("pairingCode") String pairingCode);

    @Query("SELECT c FROM Couple c JOIN c.memberIds m WHERE m = :userId")
    Optional<Couple> findByMemberId(@Param("userId") Long userId);

    // Scalar projection: does not put a managed Couple into the persistence context.
    @Query("SELECT m FROM Couple c JOIN c.memberIds m WHERE c.id = :coupleId ORDER BY m")
    List<Long> findMemberIds(@Param("coupleId") Long coupleId);

    @Query("""
            SELECT CASE WHEN COUNT(c) > 0 THEN true ELSE false END
            FROM Couple c JOIN c.memberIds m
            WHERE c.id = :coupleId AND m = :userId
            """)
    boolean isMember(@Param("coupleId") Long coupleId, @Param("userId") Long userId);

    @Query("SELECT c.id FROM Couple c WHERE c.memberIds IS EMPTY")
    List<Long> findIdsWithoutMembers();

    // Couples listing at least one member whose pointer does not reference them.
    @Query("""
            SELECT DISTINCT c.id FROM Couple c JOIN c.memberIds m
            WHERE NOT EXISTS (
                SELECT u.id FROM User u
                WHERE u.id = m AND u.coupleId = c.id AND u.deletedAt IS NULL)
            """)
    List<Long> findIdsWithUnlinkedMembers();
}
