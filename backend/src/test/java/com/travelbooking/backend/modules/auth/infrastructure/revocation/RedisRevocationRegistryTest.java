package com.travelbooking.backend.modules.auth.infrastructure.revocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import com.travelbooking.backend.global.error.StorageException;
import com.travelbooking.backend.modules.auth.application.SecretGenerator;
import com.travelbooking.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class RedisRevocationRegistryTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private MutableClock clock;
    private SecretGenerator secretGenerator;
    private RedisRevocationRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T09:00:00Z");
        secretGenerator = new SecretGenerator(clock);
        registry = new RedisRevocationRegistry(redisTemplate, secretGenerator, clock);
    }

    @Test
    void revokeStoresDigestWithRemainingLifetime() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        Instant expiresAt = clock.instant().plus(Duration.ofMinutes(90));

        registry.revoke("session-token", expiresAt);

        verify(valueOperations).set(
                eq(RedisRevocationRegistry.KEY_PREFIX + secretGenerator.digest("session-token")),
                eq(expiresAt.toString()),
                eq(Duration.ofMinutes(90)));
    }

    @Test
    void alreadyExpiredTokenIsNotStored() {
        registry.revoke("session-token", clock.instant().minusSeconds(1));

        verify(redisTemplate, never()).opsForValue();
    }

    @Test
    void lookupUsesDigestKey() {
        when(redisTemplate.hasKey(RedisRevocationRegistry.KEY_PREFIX + secretGenerator.digest("session-token")))
                .thenReturn(true);

        assertThat(registry.isRevoked("session-token")).isTrue();
    }

    @Test
    void redisOutageBecomesStorageException() {
        when(redisTemplate.hasKey(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertThatThrownBy(() -> registry.isRevoked("session-token")).isInstanceOf(StorageException.class);
    }

    @Test
    void redisWriteFailureBecomesStorageException() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

        assertThatThrownBy(() -> registry.revoke("session-token", clock.instant().plusSeconds(60)))
                .isInstanceOf(StorageException.class);
    }
}
