package com.twosome.backend.service;

import com.twosome.backend.model.Couple;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Draws random pairing codes: {@value Couple#PAIRING_CODE_LENGTH} characters of {@code [A-Z0-9]}.
 * Uniqueness is checked by the caller against the store.
 */
@Component
@RequiredArgsConstructor
public class PairingCodeGenerator {

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final Pattern CODE_PATTERN =
            Pattern.compile("[A-Z0-9]{" + Couple.PAIRING_CODE_LENGTH + "}");

    private final SecureRandom pairingCodeRandom;

    public String next() {
        StringBuilder code = new StringBuilder(Couple.PAIRING_CODE_LENGTH);
        for (int i = 0; i < Couple.PAIRING_CODE_LENGTH; i++) {
            code.append(ALPHABET.charAt(pairingCodeRandom.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }

    /**
     * Trims and upper-cases user input. Returns null when the result cannot be a pairing code.
     */
    public static String normalize(String input) {
        if (input == null) {
            return null;
        }
        String code = input.trim().toUpperCase(Locale.ROOT);
        return CODE_PATTERN.matcher(code).matches() ? code : null;
    }
}
