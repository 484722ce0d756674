package com.twosome.backend.service;

import com.twosome.backend.config.CacheConfig;
import com.twosome.backend.exception.NotFoundException;
import com.twosome.backend.model.User;
import com.twosome.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UserCache {

    private static final Logger log = LoggerFactory.getLogger(UserCache.class);
    private final UserRepository userRepository;

    /**
     * Resolve the account id behind a Firebase UID (cached for 10 minutes).
     * Unknown or deleted accounts are not cached.
     */
    @Cacheable(value = CacheConfig.USER_ID_CACHE, key = "#firebaseUid")
    public Long getUserId(String firebaseUid) {
        return userRepository.findByFirebaseUid(firebaseUid)
                .map(User::getId)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    @CacheEvict(value = CacheConfig.USER_ID_CACHE, key = "#firebaseUid")
    public void invalidateByFirebaseUid(String firebaseUid) {
        log.debug("Evicted cached account id for {}", firebaseUid);
    }
}
