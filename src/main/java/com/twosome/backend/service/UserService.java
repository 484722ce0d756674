package com.twosome.backend.service;

import com.google.firebase.auth.FirebaseAuth;
import com.google.firebase.auth.FirebaseAuthException;
import com.twosome.backend.exception.NotFoundException;
import com.twosome.backend.model.User;
import com.twosome.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Account directory. Owns identity data and the membership pointer; the pointer itself is only
 * written through {@link #setCoupleRef(User, Long)} by the pairing orchestrator.
 */
@Service
@RequiredArgsConstructor
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);
    private final UserRepository userRepository;
    private final UserCache userCache;
    private final ObjectProvider<FirebaseAuth> firebaseAuth;
    private final Clock clock;

    public Optional<User> findById(Long id) {
        return userRepository.findActiveById(id);
    }

    public User getRequiredUser(Long id) {
        return userRepository.findActiveById(id)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    public Optional<User> findByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return userRepository.findByEmail(normalizeEmail(email));
    }

    public Optional<Long> findIdByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return userRepository.findIdByEmail(normalizeEmail(email));
    }

    public Map<Long, User> getUsersByIds(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        return userRepository.findActiveByIds(ids).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));
    }

    public Set<Long> findIdsPointingTo(Long coupleId) {
        return new HashSet<>(userRepository.findIdsByCoupleId(coupleId));
    }

    /**
     * Locks a live account row for the rest of the current transaction.
     */
    @Transactional
    public User lockUser(Long id) {
        return userRepository.findByIdForUpdate(id)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    /**
     * Locks several account rows in ascending id order. Missing ids are simply absent from the result.
     */
    @Transactional
    public List<User> lockAll(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return userRepository.findAllByIdForUpdate(new TreeSet<>(ids));
    }

    @Transactional
    public User setCoupleRef(User user, Long coupleId) {
        Long previous = user.getCoupleId();
        user.setCoupleId(coupleId);
        User saved = userRepository.save(user);
        log.debug("Membership pointer of user {} changed {} -> {}", user.getId(), previous, coupleId);
        return saved;
    }

    @Transactional
    public User createUserIfNew(String firebaseUid, String email, String name, String avatarUrl) {
        Optional<User> existing = userRepository.findByFirebaseUid(firebaseUid);
        if (existing.isPresent()) {
            return existing.get();
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("An email address is required to create an account");
        }
        String normalizedEmail = normalizeEmail(email);

        // Link an account that was created before its Firebase UID changed
        Optional<User> existingByEmail = userRepository.findByEmail(normalizedEmail);
        if (existingByEmail.isPresent()) {
            log.info("User exists with email, linking Firebase UID: {}", firebaseUid);
            User user = existingByEmail.get();
            user.setFirebaseUid(firebaseUid);
            if (avatarUrl != null) {
                user.setAvatarUrl(avatarUrl);
            }
            return userRepository.save(user);
        }

        try {
            User user = new User();
            user.setFirebaseUid(firebaseUid);
            user.setEmail(normalizedEmail);
            user.setName(name != null && !name.isBlank() ? name : normalizedEmail.split("@")[0]);
            user.setAvatarUrl(avatarUrl);
            log.info("Creating new user: {}", normalizedEmail);
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // Another request created the same account first
            log.warn("Duplicate key detected, retrying lookup for: {}", firebaseUid);
            return userRepository.findByFirebaseUid(firebaseUid)
                    .or(() -> userRepository.findByEmail(normalizedEmail))
                    .orElseThrow(() -> e);
        }
    }

    @Transactional
    public void updateFcmToken(Long userId, String token) {
        User user = getRequiredUser(userId);
        user.setFcmToken(token);
        userRepository.save(user);
    }

    /**
     * Soft-deletes and anonymises an account. The caller must already have detached it from its couple
     * and its invitations.
     */
    @Transactional
    public void markDeleted(User user) {
        log.info("Soft deleting user: {}", user.getId());
        String firebaseUid = user.getFirebaseUid();

        FirebaseAuth auth = firebaseAuth.getIfAvailable();
        if (auth != null && firebaseUid != null) {
            try {
                auth.deleteUser(firebaseUid);
                log.info("Deleted user {} from Firebase", user.getId());
            } catch (FirebaseAuthException e) {
                // The local record is still anonymised; the Firebase identity can be removed by hand.
                log.warn("Failed to delete user {} from Firebase: {}", user.getId(), e.getMessage());
            }
        }

        user.setDeletedAt(LocalDateTime.now(clock));
        user.setName("Deleted User");
        user.setEmail("deleted_" + user.getId() + "@deleted.com");
        user.setFirebaseUid("deleted_" + user.getId());
        user.setAvatarUrl(null);
        user.setFcmToken(null);
        user.setCoupleId(null);

        if (firebaseUid != null) {
            userCache.invalidateByFirebaseUid(firebaseUid);
        }
        userRepository.save(user);
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
