package com.travelbooking.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record VerifyMfaRequest(
        @NotNull(message = "accountId is required") Long accountId,
        @NotBlank(message = "code is required") String code
) {
}
