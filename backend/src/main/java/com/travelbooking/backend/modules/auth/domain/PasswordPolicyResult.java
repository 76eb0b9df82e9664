package com.travelbooking.backend.modules.auth.domain;

import java.util.List;

public record PasswordPolicyResult(boolean accepted, List<String> violations) {

    public PasswordPolicyResult {
        violations = List.copyOf(violations);
    }

    public static PasswordPolicyResult of(List<String> violations) {
        return new PasswordPolicyResult(violations.isEmpty(), violations);
    }

    public String joinedViolations() {
        return String.join("; ", violations);
    }
}
