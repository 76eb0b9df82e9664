package com.travelbooking.backend.modules.auth.application;

/**
 * Login refused because of repeated failures. Carries how long the lock still runs.
 */
public class AccountLockedException extends AuthException {

    private final long minutesRemaining;

    public AccountLockedException(String code, String detail, long minutesRemaining) {
        super(AuthErrorKind.ACCOUNT_LOCKED, code, detail);
        if (minutesRemaining < 0) {
            throw new IllegalArgumentException("minutesRemaining must be >= 0");
        }
        this.minutesRemaining = minutesRemaining;
    }

    public long getMinutesRemaining() {
        return minutesRemaining;
    }

    public long getRetryAfterSeconds() {
        return minutesRemaining * 60L;
    }
}
