package com.travelbooking.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

public record RememberMeTokenResponse(String token, OffsetDateTime expiresAt) {
}
