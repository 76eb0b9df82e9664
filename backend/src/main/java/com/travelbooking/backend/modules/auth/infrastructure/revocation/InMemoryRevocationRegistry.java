package com.travelbooking.backend.modules.auth.infrastructure.revocation;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.travelbooking.backend.modules.auth.application.RevocationRegistry;
import com.travelbooking.backend.modules.auth.application.SecretGenerator;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local registry. Not shared between instances: a multi-instance deployment must switch
 * {@code app.auth.revocation.store} to {@code redis}.
 *
 * <p>Keys are token digests; values are the token's own expiry, after which
 * {@link #purgeExpired(Instant)} drops the entry.
 */
@Component
@ConditionalOnProperty(value = "app.auth.revocation.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRevocationRegistry implements RevocationRegistry {

    private final Map<String, Instant> revoked = new ConcurrentHashMap<>();
    private final SecretGenerator secretGenerator;

    public InMemoryRevocationRegistry(SecretGenerator secretGenerator) {
        this.secretGenerator = secretGenerator;
    }

    @Override
    public void revoke(String token, Instant expiresAt) {
        revoked.merge(secretGenerator.digest(token), expiresAt, (current, incoming) -> current.isAfter(incoming) ? current : incoming);
    }

    @Override
    public boolean isRevoked(String token) {
        return token != null && revoked.containsKey(secretGenerator.digest(token));
    }

    @Override
    public int purgeExpired(Instant now) {
        int before = revoked.size();
        revoked.values().removeIf(expiresAt -> !expiresAt.isAfter(now));
        return Math.max(0, before - revoked.size());
    }
}
