package com.travelbooking.backend.modules.auth.application;

import com.travelbooking.backend.global.error.ProblemException;

public class AuthException extends ProblemException {

    private final AuthErrorKind kind;

    public AuthException(AuthErrorKind kind, String code, String detail) {
        super(kind.status(), code, detail);
        this.kind = kind;
    }

    public AuthErrorKind getKind() {
        return kind;
    }

    public static AuthException conflict(String code, String detail) {
        return new AuthException(AuthErrorKind.CONFLICT, code, detail);
    }

    public static AuthException validation(String code, String detail) {
        return new AuthException(AuthErrorKind.VALIDATION, code, detail);
    }

    public static AuthException notFoundOrExpired(String code, String detail) {
        return new AuthException(AuthErrorKind.NOT_FOUND_OR_EXPIRED, code, detail);
    }

    public static AuthException unauthenticated(String detail) {
        return new AuthException(AuthErrorKind.UNAUTHENTICATED, "UNAUTHENTICATED", detail);
    }

    public static AuthException unverified(String detail) {
        return new AuthException(AuthErrorKind.UNVERIFIED, "EMAIL_NOT_VERIFIED", detail);
    }
}
