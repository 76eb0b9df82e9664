package com.travelbooking.backend.modules.auth.application;

import java.time.Instant;

/**
 * Session tokens invalidated before their natural expiry.
 *
 * <p>Entries are only needed until the token would have expired anyway, so implementations may drop
 * them after {@code expiresAt}.
 */
public interface RevocationRegistry {

    /** Idempotent. */
    void revoke(String token, Instant expiresAt);

    boolean isRevoked(String token);

    /** Returns the number of entries dropped. */
    default int purgeExpired(Instant now) {
        return 0;
    }
}
