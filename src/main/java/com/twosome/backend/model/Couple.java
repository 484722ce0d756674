package com.twosome.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Entity
@Table(name = "couples", uniqueConstraints = {
        @UniqueConstraint(name = "uk_couples_pairing_code", columnNames = "pairing_code")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Couple {

    public enum Status {
        PENDING,
        ACTIVE,
        INACTIVE,
        BLOCKED
    }

    public static final int MAX_MEMBERS = 2;
    public static final int PAIRING_CODE_LENGTH = 8;

    public static final String SETTING_ALLOW_LOCATION_SHARE = "allowLocationShare";
    public static final String SETTING_THEME = "theme";
    public static final List<String> THEMES = List.of("light", "dark", "auto");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // user_id is unique across all couples: an account is listed in at most one couple.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "couple_members",
            joinColumns = @JoinColumn(name = "couple_id"),
            uniqueConstraints = @UniqueConstraint(name = "uk_couple_members_user", columnNames = "user_id"))
    @Column(name = "user_id", nullable = false)
    @Builder.Default
    private Set<Long> memberIds = new LinkedHashSet<>();

    @Column(name = "pairing_code", nullable = false, length = PAIRING_CODE_LENGTH)
    private String pairingCode;

    @Column(name = "anniversary_date", nullable = false)
    private LocalDate anniversaryDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Status status = Status.PENDING;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "couple_settings", joinColumns = @JoinColumn(name = "couple_id"))
    @MapKeyColumn(name = "setting_key", length = 64)
    @Column(name = "setting_value")
    @Builder.Default
    private Map<String, String> settings = new HashMap<>();

    @Version
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public static Map<String, String> defaultSettings() {
        Map<String, String> settings = new HashMap<>();
        settings.put(SETTING_ALLOW_LOCATION_SHARE, "false");
        settings.put(SETTING_THEME, "light");
        return settings;
    }

    public boolean hasMember(Long userId) {
        return userId != null && memberIds.contains(userId);
    }

    public boolean isComplete() {
        return memberIds.size() >= MAX_MEMBERS;
    }

    public boolean isEmpty() {
        return memberIds.isEmpty();
    }

    public void addMember(Long userId) {
        if (isComplete()) {
            throw new IllegalStateException("Couple " + id + " already has " + MAX_MEMBERS + " members");
        }
        memberIds.add(userId);
        refreshStatus();
    }

    public boolean removeMember(Long userId) {
        boolean removed = memberIds.remove(userId);
        refreshStatus();
        return removed;
    }

    /**
     * Two members make a couple active; one member leaves it waiting for a partner.
     * Blocked and inactive couples keep their status.
     */
    public void refreshStatus() {
        if (status == Status.BLOCKED || status == Status.INACTIVE) {
            return;
        }
        status = isComplete() ? Status.ACTIVE : Status.PENDING;
    }
}
