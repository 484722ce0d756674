package com.twosome.backend.repository;

import com.twosome.backend.model.User;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {
    // Lookups filter out soft-deleted users (deletedAt IS NULL)

    @Query("SELECT u FROM User u WHERE u.firebaseUid = :firebaseUid AND u.deletedAt IS NULL")
    Optional<User> findByFirebaseUid(@Param("firebaseUid") String firebaseUid);

    @Query("SELECT u FROM User u WHERE u.email = :email AND u.deletedAt IS NULL")
    Optional<User> findByEmail(@Param("email") String email);

    // Scalar lookup: leaves no managed User behind that a later row lock would not refresh.
    @Query("SELECT u.id FROM User u WHERE u.email = :email AND u.deletedAt IS NULL")
    Optional<Long> findIdByEmail(@Param("email") String email);

    @Query("SELECT u FROM User u WHERE u.id = :id AND u.deletedAt IS NULL")
    Optional<User> findActiveById(@Param("id") Long id);

    @Query("SELECT u FROM User u WHERE u.id IN :ids AND u.deletedAt IS NULL")
    List<User> findActiveByIds(@Param("ids") Collection<Long> ids);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.id = :id AND u.deletedAt IS NULL")
    Optional<User> findByIdForUpdate(@Param("id") Long id);

    // Rows are locked in ascending id order so concurrent protocols never wait on each other in a cycle.
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM User u WHERE u.id IN :ids ORDER BY u.id")
    List<User> findAllByIdForUpdate(@Param("ids") Collection<Long> ids);

    @Query("SELECT u.id FROM User u WHERE u.coupleId = :coupleId ORDER BY u.id")
    List<Long> findIdsByCoupleId(@Param("coupleId") Long coupleId);

    // Accounts whose pointer names a couple that does not list them (or no longer exists).
    @Query("""
            SELECT u.id FROM User u
            WHERE u.coupleId IS NOT NULL
              AND NOT EXISTS (
                  SELECT c.id FROM Couple c JOIN c.memberIds m
                  WHERE c.id = u.coupleId AND m = u.id)
            """)
    List<Long> findIdsWithDanglingCoupleRef();
}
