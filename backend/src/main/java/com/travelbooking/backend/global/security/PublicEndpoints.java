package com.travelbooking.backend.global.security;

import java.util.Set;

/**
 * Routes reachable without a session token. A stale bearer header on these is ignored rather than
 * rejected.
 */
final class PublicEndpoints {

    static final String[] AUTH_PATHS = {
            "/auth/signup",
            "/auth/verify-email",
            "/auth/verification/resend",
            "/auth/login",
            "/auth/mfa/verify",
            "/auth/password/forgot",
            "/auth/password/reset",
            "/auth/remember-me/login"
    };

    static final String[] DOC_PATHS = {
            "/v3/api-docs/**",
            "/swagger-ui/**",
            "/swagger-ui.html"
    };

    private static final Set<String> AUTH_PATH_SET = Set.of(AUTH_PATHS);

    private PublicEndpoints() {
    }

    static boolean isPublic(String servletPath) {
        return AUTH_PATH_SET.contains(servletPath)
                || servletPath.startsWith("/v3/api-docs")
                || servletPath.startsWith("/swagger-ui")
                || servletPath.startsWith("/actuator/health");
    }
}
