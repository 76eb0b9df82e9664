package com.travelbooking.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record UpdateMfaPreferenceRequest(
        @NotNull(message = "enabled is required") Boolean enabled,
        @NotBlank(message = "currentPassword is required") String currentPassword
) {
}
