package com.travelbooking.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
