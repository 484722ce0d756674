package com.twosome.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning for the pairing core, bound from {@code twosome.pairing.*}.
 */
@Data
@ConfigurationProperties(prefix = "twosome.pairing")
public class PairingProperties {

    /** Lifetime of a pending invitation. */
    private Duration invitationTtl = Duration.ofDays(7);

    /** Random draws before pairing-code generation is treated as a fatal configuration error. */
    private int pairingCodeMaxAttempts = 10;

    private Reconciliation reconciliation = new Reconciliation();

    @Data
    public static class Reconciliation {

        private boolean enabled = true;

        private long intervalMs = 600_000L;
    }
}
