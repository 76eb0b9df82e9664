package com.travelbooking.backend.modules.auth.infrastructure.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Base64;

import org.junit.jupiter.api.Test;

class JwtTokenProviderTest {

    @Test
    void missingSecretFailsStartup() {
        assertThatThrownBy(() -> new JwtTokenProvider(""))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.secret");
    }

    @Test
    void shortSecretFailsStartup() {
        assertThatThrownBy(() -> new JwtTokenProvider("too-short-secret"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 bytes");
    }

    @Test
    void base64SecretIsDecoded() {
        byte[] raw = new byte[48];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = (byte) i;
        }

        JwtTokenProvider provider = new JwtTokenProvider(Base64.getEncoder().encodeToString(raw));

        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(raw);
        assertThat(provider.getSecretKey().getAlgorithm()).isEqualTo("HmacSHA256");
    }
}
