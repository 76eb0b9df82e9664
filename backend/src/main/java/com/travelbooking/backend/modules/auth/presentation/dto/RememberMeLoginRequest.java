package com.travelbooking.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record RememberMeLoginRequest(@NotBlank(message = "token is required") String token) {
}
