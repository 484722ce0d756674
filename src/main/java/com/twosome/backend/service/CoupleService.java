package com.twosome.backend.service;

import com.twosome.backend.config.PairingProperties;
import com.twosome.backend.exception.ForbiddenException;
import com.twosome.backend.exception.InvalidInputException;
import com.twosome.backend.exception.NotFoundException;
import com.twosome.backend.exception.PairingInvariantException;
import com.twosome.backend.model.Couple;
import com.twosome.backend.model.CoupleStats;
import com.twosome.backend.model.User;
import com.twosome.backend.repository.CoupleRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Couple aggregate store. Membership changes go through the pairing orchestrator, which also owns
 * the account pointers; everything here works on the couple row alone.
 */
@Service
@RequiredArgsConstructor
public class CoupleService {

    private static final Logger log = LoggerFactory.getLogger(CoupleService.class);

    static final int MAX_SETTING_KEY_LENGTH = 64;
    static final int MAX_SETTING_VALUE_LENGTH = 255;

    private final CoupleRepository coupleRepository;
    private final UserService userService;
    private final PairingCodeGenerator pairingCodeGenerator;
    private final PairingProperties pairingProperties;
    private final Clock clock;

    /**
     * Creates an active couple for two accounts. The caller holds the locks on both accounts.
     */
    @Transactional
    public Couple create(Long memberA, Long memberB, LocalDate anniversaryDate) {
        if (memberA.equals(memberB)) {
            throw new InvalidInputException("A couple needs two different accounts");
        }
        LinkedHashSet<Long> members = new LinkedHashSet<>();
        members.add(memberA);
        members.add(memberB);

        Couple couple = Couple.builder()
                .memberIds(members)
                .pairingCode(generateUniquePairingCode())
                .anniversaryDate(anniversaryDate)
                .status(Couple.Status.ACTIVE)
                .settings(Couple.defaultSettings())
                .build();
        Couple saved = coupleRepository.saveAndFlush(couple);
        log.debug("Created couple {} for users {} and {}", saved.getId(), memberA, memberB);
        return saved;
    }

    /**
     * Creates a one-member couple waiting for a partner to join with its pairing code.
     */
    @Transactional
    public Couple openPlaceholder(Long memberId, LocalDate anniversaryDate) {
        LinkedHashSet<Long> members = new LinkedHashSet<>();
        members.add(memberId);

        Couple couple = Couple.builder()
                .memberIds(members)
                .pairingCode(generateUniquePairingCode())
                .anniversaryDate(anniversaryDate)
                .status(Couple.Status.PENDING)
                .settings(Couple.defaultSettings())
                .build();
        Couple saved = coupleRepository.saveAndFlush(couple);
        log.debug("Opened waiting couple {} for user {}", saved.getId(), memberId);
        return saved;
    }

    /**
     * Draws codes until one is not in use. Running out of attempts means the code space or the
     * random source is broken, so it is reported as fatal rather than to the caller.
     */
    public String generateUniquePairingCode() {
        int maxAttempts = pairingProperties.getPairingCodeMaxAttempts();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String code = pairingCodeGenerator.next();
            if (!coupleRepository.existsByPairingCode(code)) {
                return code;
            }
            log.warn("Pairing code collision on attempt {}/{}", attempt, maxAttempts);
        }
        throw new PairingInvariantException(
                "Could not generate a unique pairing code after " + maxAttempts + " attempts");
    }

    public Optional<Couple> findById(Long coupleId) {
        return coupleRepository.findById(coupleId);
    }

    public Optional<Couple> findByPairingCode(String pairingCode) {
        String code = PairingCodeGenerator.normalize(pairingCode);
        return code == null ? Optional.empty() : coupleRepository.findByPairingCode(code);
    }

    public Optional<Couple> findByMember(Long accountId) {
        return coupleRepository.findByMemberId(accountId);
    }

    public Couple getRequiredCouple(Long coupleId) {
        return findById(coupleId)
                .orElseThrow(() -> new NotFoundException("Couple not found"));
    }

    public Couple getByMember(Long accountId) {
        return findByMember(accountId)
                .orElseThrow(() -> new NotFoundException("You are not in a couple"));
    }

    public Couple getForMember(Long coupleId, Long accountId) {
        Couple couple = getRequiredCouple(coupleId);
        requireMember(couple, accountId);
        return couple;
    }

    /**
     * Membership check used by every couple-scoped resource.
     */
    public boolean isMember(Long coupleId, Long accountId) {
        if (coupleId == null || accountId == null) {
            return false;
        }
        return coupleRepository.isMember(coupleId, accountId);
    }

    @Transactional
    public Couple updateSettings(Long coupleId, Long accountId, Map<String, Object> changes) {
        if (changes == null || changes.isEmpty()) {
            throw new InvalidInputException("No settings provided");
        }
        Map<String, String> validated = validateSettings(changes);

        Couple couple = lockById(coupleId);
        requireMember(couple, accountId);
        couple.getSettings().putAll(validated);
        Couple saved = coupleRepository.save(couple);
        log.info("User {} updated settings {} of couple {}", accountId, validated.keySet(), coupleId);
        return saved;
    }

    @Transactional
    public Couple updateAnniversaryDate(Long coupleId, Long accountId, LocalDate anniversaryDate) {
        requireNotFuture(anniversaryDate);

        Couple couple = lockById(coupleId);
        requireMember(couple, accountId);
        couple.setAnniversaryDate(anniversaryDate);
        Couple saved = coupleRepository.save(couple);
        log.info("User {} set anniversary of couple {} to {}", accountId, coupleId, anniversaryDate);
        return saved;
    }

    @Transactional
    public Couple regeneratePairingCode(Long coupleId, Long accountId) {
        Couple couple = lockById(coupleId);
        requireMember(couple, accountId);
        couple.setPairingCode(generateUniquePairingCode());
        Couple saved = coupleRepository.saveAndFlush(couple);
        log.info("User {} regenerated the pairing code of couple {}", accountId, coupleId);
        return saved;
    }

    @Transactional
    public Couple addMember(Couple couple, Long accountId) {
        couple.addMember(accountId);
        return coupleRepository.saveAndFlush(couple);
    }

    /**
     * Removes one member. Returns false when the couple became empty and was deleted.
     * The pointers of the accounts involved are left to the caller.
     */
    @Transactional
    public boolean removeMember(Couple couple, Long accountId) {
        couple.removeMember(accountId);
        if (couple.isEmpty()) {
            coupleRepository.delete(couple);
            coupleRepository.flush();
            log.debug("Couple {} has no members left and was deleted", couple.getId());
            return false;
        }
        coupleRepository.saveAndFlush(couple);
        return true;
    }

    @Transactional
    public void delete(Couple couple) {
        coupleRepository.delete(couple);
        coupleRepository.flush();
    }

    @Transactional
    public Couple lockById(Long coupleId) {
        return coupleRepository.findByIdForUpdate(coupleId)
                .orElseThrow(() -> new NotFoundException("Couple not found"));
    }

    @Transactional
    public Optional<Couple> tryLock(Long coupleId) {
        return coupleRepository.findByIdForUpdate(coupleId);
    }

    @Transactional
    public Optional<Couple> lockByPairingCode(String pairingCode) {
        return coupleRepository.findByPairingCodeForUpdate(pairingCode);
    }

    public List<Long> findMemberIds(Long coupleId) {
        return coupleRepository.findMemberIds(coupleId);
    }

    @Transactional(readOnly = true)
    public User getPartner(Long accountId) {
        Couple couple = getByMember(accountId);
        return couple.getMemberIds().stream()
                .filter(id -> !id.equals(accountId))
                .findFirst()
                .flatMap(userService::findById)
                .orElseThrow(() -> new NotFoundException("Partner not found"));
    }

    @Transactional(readOnly = true)
    public CoupleStats getStats(Long accountId) {
        Couple couple = getByMember(accountId);
        long days = ChronoUnit.DAYS.between(couple.getAnniversaryDate(), LocalDate.now(clock));
        return CoupleStats.builder()
                .coupleId(couple.getId())
                .relationshipDays(days)
                .anniversaryDate(couple.getAnniversaryDate())
                .memberCount(couple.getMemberIds().size())
                .status(couple.getStatus())
                .lastActivity(couple.getUpdatedAt())
                .build();
    }

    public void requireNotFuture(LocalDate anniversaryDate) {
        if (anniversaryDate == null) {
            throw new InvalidInputException("Anniversary date is required");
        }
        if (anniversaryDate.isAfter(LocalDate.now(clock))) {
            throw new InvalidInputException("Anniversary date cannot be in the future");
        }
    }

    private void requireMember(Couple couple, Long accountId) {
        if (!couple.hasMember(accountId)) {
            throw new ForbiddenException("You are not a member of this couple");
        }
    }

    private Map<String, String> validateSettings(Map<String, Object> changes) {
        Map<String, String> validated = new HashMap<>();
        for (Map.Entry<String, Object> entry : changes.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (key == null || key.isBlank() || key.length() > MAX_SETTING_KEY_LENGTH) {
                throw new InvalidInputException("Setting keys must be 1-" + MAX_SETTING_KEY_LENGTH + " characters");
            }
            if (value == null) {
                throw new InvalidInputException("Setting " + key + " needs a value");
            }

            String text = value.toString();
            if (Couple.SETTING_ALLOW_LOCATION_SHARE.equals(key)) {
                if (!(value instanceof Boolean) && !"true".equals(text) && !"false".equals(text)) {
                    throw new InvalidInputException(key + " must be true or false");
                }
            } else if (Couple.SETTING_THEME.equals(key)) {
                if (!Couple.THEMES.contains(text)) {
                    throw new InvalidInputException("theme must be one of " + Couple.THEMES);
                }
            } else if (text.length() > MAX_SETTING_VALUE_LENGTH) {
                throw new InvalidInputException(
                        "Setting " + key + " exceeds " + MAX_SETTING_VALUE_LENGTH + " characters");
            }
            validated.put(key, text);
        }
        return validated;
    }
}
