package com.travelbooking.backend.global.security;

import java.io.IOException;

import com.travelbooking.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.MediaType;

/**
 * Writes problem bodies for rejections that happen in the filter chain, before any controller
 * advice can run.
 */
final class SecurityProblemWriter {

    private SecurityProblemWriter() {
    }

    static void write(ObjectMapper objectMapper, HttpServletResponse response, ProblemResponse body) throws IOException {
        response.setStatus(body.status());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
