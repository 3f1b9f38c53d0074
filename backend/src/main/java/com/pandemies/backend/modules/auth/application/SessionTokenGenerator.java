package com.pandemies.backend.modules.auth.application;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Produces URL-safe session tokens from a fixed number of random bytes.
 * 32 bytes give 43 characters and 256 bits of entropy.
 */
@Component
public class SessionTokenGenerator {

    public static final int MIN_TOKEN_BYTES = 16;
    // Base64 of 190 bytes still fits sessions.token VARCHAR(255).
    public static final int MAX_TOKEN_BYTES = 190;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom secureRandom;
    private final int tokenBytes;

    @Autowired
    public SessionTokenGenerator(@Value("${app.session.token-bytes:32}") int tokenBytes) {
        this(tokenBytes, new SecureRandom());
    }

    SessionTokenGenerator(int tokenBytes, SecureRandom secureRandom) {
        if (tokenBytes < MIN_TOKEN_BYTES || tokenBytes > MAX_TOKEN_BYTES) {
            throw new IllegalArgumentException(
                    "token-bytes must be between " + MIN_TOKEN_BYTES + " and " + MAX_TOKEN_BYTES + ": " + tokenBytes);
        }
        this.tokenBytes = tokenBytes;
        this.secureRandom = secureRandom;
    }

    public String generate() {
        byte[] buffer = new byte[tokenBytes];
        secureRandom.nextBytes(buffer);
        return ENCODER.encodeToString(buffer);
    }

    public int tokenLength() {
        return (tokenBytes * 4 + 2) / 3;
    }
}
