package com.travelbooking.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyChangePasswordRequest(@NotBlank(message = "code is required") String code) {
}
