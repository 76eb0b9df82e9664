package com.travelbooking.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of a login-type call. While MFA is pending {@code token} is absent and
 * {@code requiresMfa} is set; the client then calls the MFA verification with {@code id}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResponse(
        String message,
        String token,
        String tokenType,
        OffsetDateTime expiresAt,
        boolean requiresMfa,
        Long id,
        String email,
        String firstName,
        String lastName,
        String role
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static LoginResponse authenticated(String token, OffsetDateTime expiresAt, Long id, String email,
                                              String firstName, String lastName, String role) {
        return new LoginResponse("Authentication successful", token, DEFAULT_TOKEN_TYPE, expiresAt, false,
                id, email, firstName, lastName, role);
    }

    public static LoginResponse mfaPending(Long id, String email) {
        return new LoginResponse("A verification code has been sent to your email", null, null, null, true,
                id, email, null, null, null);
    }
}
