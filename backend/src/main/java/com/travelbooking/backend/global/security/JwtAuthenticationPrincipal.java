package com.travelbooking.backend.global.security;

public record JwtAuthenticationPrincipal(Long accountId, String email, boolean organiser) {

    public String role() {
        return organiser ? "ORGANISER" : "CLIENT";
    }
}
