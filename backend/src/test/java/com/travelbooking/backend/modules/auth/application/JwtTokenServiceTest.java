package com.travelbooking.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.reflect.Field;
import java.time.Duration;

import com.travelbooking.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.travelbooking.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.travelbooking.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.travelbooking.backend.modules.auth.domain.Account;
import com.travelbooking.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.travelbooking.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private MutableClock clock;
    private JwtTokenService tokenService;
    private Account organiser;

    @BeforeEach
    void setUp() throws ReflectiveOperationException {
        clock = MutableClock.startingAt("2026-03-01T09:00:00Z");
        tokenService = new JwtTokenService(new JwtTokenProvider(AuthServiceTest.JWT_SECRET), 3_600_000L, "travel_booking_app", clock);
        organiser = Account.register("olivia@example.com", "Olivia", "Organiser", "hash", true);
        Field id = Account.class.getDeclaredField("id");
        id.setAccessible(true);
        id.set(organiser, 42L);
    }

    @Test
    @DisplayName("issued tokens carry account id, email and organiser flag")
    void issuedTokenRoundTripsClaims() {
        IssuedToken issued = tokenService.issue(organiser);

        ParsedToken parsed = tokenService.parse(issued.token());

        assertThat(parsed.accountId()).isEqualTo(42L);
        assertThat(parsed.email()).isEqualTo("olivia@example.com");
        assertThat(parsed.organiser()).isTrue();
        assertThat(parsed.expiresAt()).isEqualTo(issued.expiresAt());
        assertThat(Duration.between(parsed.issuedAt(), parsed.expiresAt())).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("expired tokens are rejected")
    void expiredTokenIsRejected() {
        String token = tokenService.issue(organiser).token();

        clock.advance(Duration.ofHours(1).plusSeconds(1));

        assertThatThrownBy(() -> tokenService.parse(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    @DisplayName("tokens signed with another key or issuer are rejected")
    void foreignTokensAreRejected() {
        JwtTokenService otherKey = new JwtTokenService(
                new JwtTokenProvider("another-unit-test-secret-that-is-long-enough"), 3_600_000L, "travel_booking_app", clock);
        JwtTokenService otherIssuer = new JwtTokenService(
                new JwtTokenProvider(AuthServiceTest.JWT_SECRET), 3_600_000L, "someone_else", clock);

        assertThatThrownBy(() -> tokenService.parse(otherKey.issue(organiser).token()))
                .isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> tokenService.parse(otherIssuer.issue(organiser).token()))
                .isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> tokenService.parse("not-a-jwt"))
                .isInstanceOf(InvalidTokenException.class);
    }
}
