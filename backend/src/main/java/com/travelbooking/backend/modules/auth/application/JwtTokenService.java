package com.travelbooking.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;

import com.travelbooking.backend.modules.auth.domain.Account;
import com.travelbooking.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Mints and checks signed session tokens. Claims: {@code accountId}, {@code email},
 * {@code isOrganiser}, plus issuer, issued-at and expiry.
 */
@Service
public class JwtTokenService {

    public static final String CLAIM_ACCOUNT_ID = "accountId";
    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_IS_ORGANISER = "isOrganiser";

    private final JwtTokenProvider tokenProvider;
    private final long sessionTtlMillis;
    private final String issuer;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:28800000}") long sessionTtlMillis,
            @Value("${jwt.issuer:travel_booking_app}") String issuer,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.sessionTtlMillis = sessionTtlMillis;
        this.issuer = issuer;
        this.clock = clock;
    }

    public IssuedToken issue(Account account) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(sessionTtlMillis);

        String token = Jwts.builder()
                .subject(String.valueOf(account.getId()))
                .issuer(issuer)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_ACCOUNT_ID, account.getId())
                .claim(CLAIM_EMAIL, account.getEmail())
                .claim(CLAIM_IS_ORGANISER, account.isOrganiser())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(token, OffsetDateTime.ofInstant(expiry, clock.getZone()));
    }

    public ParsedToken parse(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            Number accountId = claims.get(CLAIM_ACCOUNT_ID, Number.class);
            if (accountId == null) {
                throw new InvalidTokenException("Session token carries no account id", null);
            }
            String email = claims.get(CLAIM_EMAIL, String.class);
            Boolean organiser = claims.get(CLAIM_IS_ORGANISER, Boolean.class);
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    accountId.longValue(),
                    email,
                    Boolean.TRUE.equals(organiser),
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid session token", e);
        }
    }

    public long getSessionTtlMillis() {
        return sessionTtlMillis;
    }

    public record IssuedToken(String token, OffsetDateTime expiresAt) {
    }

    public record ParsedToken(Long accountId, String email, boolean organiser, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
