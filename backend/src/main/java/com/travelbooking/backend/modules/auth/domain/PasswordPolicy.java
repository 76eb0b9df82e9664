package com.travelbooking.backend.modules.auth.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

/**
 * Password strength rules applied at signup, reset and change.
 *
 * <p>{@link #evaluate(String)} reports every violated rule at once, in a fixed order.
 * {@link #containsIdentifier(String, String)} is a separate gate: an accepted password may still
 * embed the account's email local-part, and callers must check both.
 */
@Component
public class PasswordPolicy {

    public static final int MIN_LENGTH = 12;
    public static final int MAX_LENGTH = 128;
    public static final int MAX_SEQUENTIAL_RUN = 3;
    public static final String SPECIAL_CHARACTERS = "!@#$%^&*()_+-=[]{};':\"\\|,.<>/?";

    private static final List<String> COMMON_PASSWORD_FRAGMENTS = List.of(
            "password", "123456", "12345678", "qwerty", "abc123", "monkey", "letmein",
            "trustno1", "dragon", "baseball", "111111", "iloveyou", "master", "sunshine",
            "ashley", "bailey", "shadow", "welcome", "admin"
    );

    public PasswordPolicyResult evaluate(String password) {
        List<String> violations = new ArrayList<>();
        if (password == null || password.isEmpty()) {
            violations.add("Password is required");
            return PasswordPolicyResult.of(violations);
        }

        int length = password.codePointCount(0, password.length());
        if (length < MIN_LENGTH) {
            violations.add("Password must be at least " + MIN_LENGTH + " characters long");
        }
        if (length > MAX_LENGTH) {
            violations.add("Password must not exceed " + MAX_LENGTH + " characters");
        }
        if (password.chars().noneMatch(ch -> ch >= 'A' && ch <= 'Z')) {
            violations.add("Password must contain at least one uppercase letter (A-Z)");
        }
        if (password.chars().noneMatch(ch -> ch >= 'a' && ch <= 'z')) {
            violations.add("Password must contain at least one lowercase letter (a-z)");
        }
        if (password.chars().noneMatch(ch -> ch >= '0' && ch <= '9')) {
            violations.add("Password must contain at least one number");
        }
        if (password.chars().noneMatch(ch -> SPECIAL_CHARACTERS.indexOf(ch) >= 0)) {
            violations.add("Password must contain at least one special character (" + SPECIAL_CHARACTERS + ")");
        }
        if (isCommonPassword(password)) {
            violations.add("Password is too common or predictable");
        }
        if (hasSequentialRun(password)) {
            violations.add("Password must not contain more than " + MAX_SEQUENTIAL_RUN + " sequential characters");
        }
        return PasswordPolicyResult.of(violations);
    }

    public boolean containsIdentifier(String password, String email) {
        if (password == null || email == null) {
            return false;
        }
        int at = email.indexOf('@');
        String localPart = (at >= 0 ? email.substring(0, at) : email).toLowerCase(Locale.ROOT);
        if (localPart.isEmpty()) {
            return false;
        }
        return password.toLowerCase(Locale.ROOT).contains(localPart);
    }

    private boolean isCommonPassword(String password) {
        String lower = password.toLowerCase(Locale.ROOT);
        return COMMON_PASSWORD_FRAGMENTS.stream().anyMatch(lower::contains);
    }

    // "abcd", "4321": MAX_SEQUENTIAL_RUN + 1 code points moving by exactly one in the same direction.
    private boolean hasSequentialRun(String password) {
        int[] codePoints = password.codePoints().toArray();
        int runLength = 1;
        int direction = 0;
        for (int i = 1; i < codePoints.length; i++) {
            int step = codePoints[i] - codePoints[i - 1];
            if ((step == 1 || step == -1) && step == direction) {
                runLength++;
            } else if (step == 1 || step == -1) {
                direction = step;
                runLength = 2;
            } else {
                direction = 0;
                runLength = 1;
            }
            if (runLength > MAX_SEQUENTIAL_RUN) {
                return true;
            }
        }
        return false;
    }
}
