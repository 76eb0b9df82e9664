package com.travelbooking.backend.global.security;

import java.io.IOException;

import com.travelbooking.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * 401 for protected routes. A presented but unusable bearer token (bad signature, expired, logged
 * out) is reported as {@code invalid_token} in the challenge; a missing one gets the bare challenge.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String BEARER_CHALLENGE = "Bearer realm=\"travel-booking\"";
    static final String INVALID_TOKEN_CHALLENGE = BEARER_CHALLENGE + ", error=\"invalid_token\"";

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        boolean tokenRejected = authException instanceof BadCredentialsException;
        String detail = tokenRejected ? authException.getMessage() : "No authorization token was found";

        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, tokenRejected ? INVALID_TOKEN_CHALLENGE : BEARER_CHALLENGE);
        SecurityProblemWriter.write(objectMapper, response,
                ProblemResponse.of(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", detail, request.getRequestURI()));
    }
}
