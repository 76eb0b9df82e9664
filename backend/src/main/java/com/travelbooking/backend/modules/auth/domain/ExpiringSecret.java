package com.travelbooking.backend.modules.auth.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.OffsetDateTime;
import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * A one-time secret (verification token, reset token, MFA code) stored as its digest together with
 * its expiry. Column names are supplied by {@code @AttributeOverrides} on the owning entity.
 *
 * <p>Every check looks at expiry first: an expired secret never matches, even byte for byte.
 */
@Embeddable
public class ExpiringSecret {

    @Column(name = "value_hash", length = 128)
    private String valueHash;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    protected ExpiringSecret() {
    }

    private ExpiringSecret(String valueHash, OffsetDateTime expiresAt) {
        this.valueHash = Objects.requireNonNull(valueHash, "valueHash");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public static ExpiringSecret of(String valueHash, OffsetDateTime expiresAt) {
        return new ExpiringSecret(valueHash, expiresAt);
    }

    public String getValueHash() {
        return valueHash;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isExpired(OffsetDateTime now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }

    public boolean isLive(OffsetDateTime now) {
        return valueHash != null && !isExpired(now);
    }

    public boolean matches(String candidateHash, OffsetDateTime now) {
        if (!isLive(now) || candidateHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
                valueHash.getBytes(StandardCharsets.UTF_8),
                candidateHash.getBytes(StandardCharsets.UTF_8)
        );
    }
}
