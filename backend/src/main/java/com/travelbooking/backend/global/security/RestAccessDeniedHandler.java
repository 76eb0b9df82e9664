package com.travelbooking.backend.global.security;

import java.io.IOException;

import com.travelbooking.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * 403 for an authenticated caller without the role a route requires (a client on an organiser-only route).
 */
@Component
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    public RestAccessDeniedHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        SecurityProblemWriter.write(objectMapper, response, ProblemResponse.of(HttpStatus.FORBIDDEN, "FORBIDDEN",
                "This route is restricted to organisers", request.getRequestURI()));
    }
}
