package com.travelbooking.backend.global.security;

import com.travelbooking.backend.modules.auth.application.AuthException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            throw AuthException.unauthenticated("No authorization token was found");
        }
        return principal;
    }

    public static Long getCurrentAccountId() {
        return getCurrentPrincipal().accountId();
    }

    /** The raw bearer token of the current request. */
    public static String getCurrentToken() {
        getCurrentPrincipal();
        Object credentials = SecurityContextHolder.getContext().getAuthentication().getCredentials();
        if (!(credentials instanceof String token)) {
            throw AuthException.unauthenticated("No authorization token was found");
        }
        return token;
    }
}
