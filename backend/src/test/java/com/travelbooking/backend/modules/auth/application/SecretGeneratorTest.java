package com.travelbooking.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.Set;

import com.travelbooking.backend.support.MutableClock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SecretGeneratorTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T09:00:00Z");
    private final SecretGenerator generator = new SecretGenerator(clock);

    @Test
    @DisplayName("tokens are URL-safe base64 without padding")
    void tokensAreUrlSafe() {
        String standard = generator.standardToken();
        String rememberMe = generator.rememberMeToken();

        assertThat(standard).hasSize(43).matches("[A-Za-z0-9_-]+");
        assertThat(rememberMe).hasSize(86).matches("[A-Za-z0-9_-]+");
        assertThat(generator.standardToken()).isNotEqualTo(standard);
    }

    @Test
    @DisplayName("numeric codes are six digits without a leading zero")
    void numericCodesStayInRange() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            String code = generator.numericCode();
            assertThat(Integer.parseInt(code)).isBetween(100_000, 999_999);
            seen.add(code);
        }
        assertThat(seen.size()).isGreaterThan(400);
    }

    @Test
    @DisplayName("expiry is measured against the injected clock")
    void expiryFollowsClock() {
        OffsetDateTime expiresAt = generator.expiryAt(10);

        assertThat(expiresAt).isEqualTo(OffsetDateTime.parse("2026-03-01T09:10:00Z"));
        assertThat(generator.isExpired(expiresAt)).isFalse();
        clock.advance(Duration.ofMinutes(10));
        assertThat(generator.isExpired(expiresAt)).isTrue();
        assertThat(generator.isExpired(null)).isTrue();
    }

    @Test
    @DisplayName("digest is a stable SHA-256 hex string")
    void digestIsSha256Hex() {
        assertThat(generator.digest("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(generator.digest(null)).isNull();
    }
}
