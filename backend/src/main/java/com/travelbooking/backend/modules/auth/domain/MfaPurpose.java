package com.travelbooking.backend.modules.auth.domain;

/**
 * Flow that issued the account's current MFA code. A code only completes the flow it was issued for.
 */
public enum MfaPurpose {
    LOGIN,
    PASSWORD_CHANGE
}
