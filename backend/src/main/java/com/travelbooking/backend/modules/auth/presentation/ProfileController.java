package com.travelbooking.backend.modules.auth.presentation;

import com.travelbooking.backend.global.security.SecurityUtils;
import com.travelbooking.backend.modules.auth.application.AuthService;
import com.travelbooking.backend.modules.auth.presentation.dto.AccountProfileResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Current account profile")
    @GetMapping("/profile/me")
    public ResponseEntity<AccountProfileResponse> me() {
        return ResponseEntity.ok(authService.loadProfile(SecurityUtils.getCurrentAccountId()));
    }
}
