package com.travelbooking.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AccountProfileResponse(
        Long id,
        String email,
        String firstName,
        String lastName,
        String role,
        @JsonProperty("isOrganiser") boolean isOrganiser,
        boolean emailVerified,
        boolean mfaEnabled,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
