package com.travelbooking.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.HexFormat;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Random tokens, MFA codes and expiry arithmetic. All time reads go through the injected clock.
 */
@Component
public class SecretGenerator {

    public static final int STANDARD_TOKEN_BYTES = 32;
    public static final int REMEMBER_ME_TOKEN_BYTES = 64;
    private static final int MFA_CODE_MIN = 100_000;
    private static final int MFA_CODE_SPAN = 900_000;

    private final SecureRandom secureRandom;
    private final Clock clock;

    @Autowired
    public SecretGenerator(Clock clock) {
        this(new SecureRandom(), clock);
    }

    SecretGenerator(SecureRandom secureRandom, Clock clock) {
        this.secureRandom = secureRandom;
        this.clock = clock;
    }

    public String randomToken(int byteLength) {
        if (byteLength <= 0) {
            throw new IllegalArgumentException("byteLength must be positive");
        }
        byte[] bytes = new byte[byteLength];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public String standardToken() {
        return randomToken(STANDARD_TOKEN_BYTES);
    }

    public String rememberMeToken() {
        return randomToken(REMEMBER_ME_TOKEN_BYTES);
    }

    public String numericCode() {
        return Integer.toString(MFA_CODE_MIN + secureRandom.nextInt(MFA_CODE_SPAN));
    }

    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    public OffsetDateTime expiryAt(Duration validFor) {
        return now().plus(validFor);
    }

    public OffsetDateTime expiryAt(long minutesFromNow) {
        return expiryAt(Duration.ofMinutes(minutesFromNow));
    }

    public boolean isExpired(OffsetDateTime expiresAt) {
        return expiresAt == null || !expiresAt.isAfter(now());
    }

    public String digest(String secret) {
        if (secret == null) {
            return null;
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
