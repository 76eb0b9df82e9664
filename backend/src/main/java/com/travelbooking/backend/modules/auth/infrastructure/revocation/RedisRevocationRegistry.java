package com.travelbooking.backend.modules.auth.infrastructure.revocation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import com.travelbooking.backend.global.error.StorageException;
import com.travelbooking.backend.modules.auth.application.RevocationRegistry;
import com.travelbooking.backend.modules.auth.application.SecretGenerator;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Shared registry for multi-instance deployments. Each entry lives exactly as long as the token it
 * revokes, so Redis expiry replaces the purge job.
 */
@Component
@ConditionalOnProperty(value = "app.auth.revocation.store", havingValue = "redis")
public class RedisRevocationRegistry implements RevocationRegistry {

    static final String KEY_PREFIX = "auth:revoked:";

    private final StringRedisTemplate redisTemplate;
    private final SecretGenerator secretGenerator;
    private final Clock clock;

    public RedisRevocationRegistry(StringRedisTemplate redisTemplate, SecretGenerator secretGenerator, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.secretGenerator = secretGenerator;
        this.clock = clock;
    }

    @Override
    public void revoke(String token, Instant expiresAt) {
        Duration ttl = Duration.between(clock.instant(), expiresAt);
        if (ttl.isNegative() || ttl.isZero()) {
            // already unusable
            return;
        }
        try {
            redisTemplate.opsForValue().set(key(token), expiresAt.toString(), ttl);
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to record revoked session token", ex);
        }
    }

    @Override
    public boolean isRevoked(String token) {
        if (token == null) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(key(token)));
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to read revoked session tokens", ex);
        }
    }

    private String key(String token) {
        return KEY_PREFIX + secretGenerator.digest(token);
    }
}
