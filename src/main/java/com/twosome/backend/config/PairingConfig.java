package com.twosome.backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PairingProperties.class)
public class PairingConfig {

    // Every "now" in the pairing core comes from here so expiry can be driven in tests.
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom pairingCodeRandom() {
        return new SecureRandom();
    }
}
