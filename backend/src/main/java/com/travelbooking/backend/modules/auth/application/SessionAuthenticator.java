package com.travelbooking.backend.modules.auth.application;

import com.travelbooking.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.travelbooking.backend.modules.auth.application.JwtTokenService.ParsedToken;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Gate for inbound bearer tokens: revocation first (cheap), then signature and expiry.
 */
@Service
public class SessionAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticator.class);

    private final RevocationRegistry revocationRegistry;
    private final JwtTokenService jwtTokenService;

    public SessionAuthenticator(RevocationRegistry revocationRegistry, JwtTokenService jwtTokenService) {
        this.revocationRegistry = revocationRegistry;
        this.jwtTokenService = jwtTokenService;
    }

    public ParsedToken authenticate(String token) {
        if (token == null || token.isBlank()) {
            throw AuthException.unauthenticated("No authorization token was found");
        }
        if (revocationRegistry.isRevoked(token)) {
            log.debug("Rejected revoked session token");
            throw AuthException.unauthenticated("Session has been logged out");
        }
        try {
            return jwtTokenService.parse(token);
        } catch (InvalidTokenException ex) {
            throw AuthException.unauthenticated("Invalid or expired session token");
        }
    }
}
