package com.travelbooking.backend.modules.auth.presentation;

import com.travelbooking.backend.global.security.SecurityUtils;
import com.travelbooking.backend.modules.auth.application.AuthService;
import com.travelbooking.backend.modules.auth.presentation.dto.AccountProfileResponse;
import com.travelbooking.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.travelbooking.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.travelbooking.backend.modules.auth.presentation.dto.LoginRequest;
import com.travelbooking.backend.modules.auth.presentation.dto.LoginResponse;
import com.travelbooking.backend.modules.auth.presentation.dto.MessageResponse;
import com.travelbooking.backend.modules.auth.presentation.dto.RememberMeLoginRequest;
import com.travelbooking.backend.modules.auth.presentation.dto.RememberMeTokenResponse;
import com.travelbooking.backend.modules.auth.presentation.dto.ResendVerificationRequest;
import com.travelbooking.backend.modules.auth.presentation.dto.ResetPasswordRequest;
import com.travelbooking.backend.modules.auth.presentation.dto.SignupRequest;
import com.travelbooking.backend.modules.auth.presentation.dto.UpdateMfaPreferenceRequest;
import com.travelbooking.backend.modules.auth.presentation.dto.VerifyChangePasswordRequest;
import com.travelbooking.backend.modules.auth.presentation.dto.VerifyEmailRequest;
import com.travelbooking.backend.modules.auth.presentation.dto.VerifyMfaRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Register an account", description = "Creates an unverified account and emails a verification link.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created"),
            @ApiResponse(responseCode = "409", description = "Email already registered"),
            @ApiResponse(responseCode = "422", description = "Password policy or field validation failed")
    })
    @PostMapping("/signup")
    public ResponseEntity<MessageResponse> signup(@Valid @RequestBody SignupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.signup(request));
    }

    @Operation(summary = "Verify email address")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Email verified"),
            @ApiResponse(responseCode = "400", description = "Token unknown or expired")
    })
    @PostMapping("/verify-email")
    public ResponseEntity<MessageResponse> verifyEmail(@Valid @RequestBody VerifyEmailRequest request) {
        return ResponseEntity.ok(authService.verifyEmail(request));
    }

    @Operation(summary = "Resend the verification email")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Verification email sent"),
            @ApiResponse(responseCode = "400", description = "No account with that email"),
            @ApiResponse(responseCode = "409", description = "Email already verified")
    })
    @PostMapping("/verification/resend")
    public ResponseEntity<MessageResponse> resendVerification(@Valid @RequestBody ResendVerificationRequest request) {
        return ResponseEntity.ok(authService.resendVerification(request));
    }

    @Operation(summary = "Log in with email and password",
            description = "Returns a session token, or requiresMfa=true when a code was emailed instead.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Authenticated or MFA pending"),
            @ApiResponse(responseCode = "400", description = "Unknown email or incorrect password"),
            @ApiResponse(responseCode = "403", description = "Email not verified"),
            @ApiResponse(responseCode = "423", description = "Account locked")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.login(request, resolveClientIp(httpRequest)));
    }

    @Operation(summary = "Complete an MFA login")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Authenticated"),
            @ApiResponse(responseCode = "400", description = "Code invalid, expired or never issued")
    })
    @PostMapping("/mfa/verify")
    public ResponseEntity<LoginResponse> verifyMfa(@Valid @RequestBody VerifyMfaRequest request) {
        return ResponseEntity.ok(authService.verifyMfa(request));
    }

    @Operation(summary = "Turn login MFA on or off")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Preference updated"),
            @ApiResponse(responseCode = "400", description = "Current password incorrect"),
            @ApiResponse(responseCode = "401", description = "Not logged in")
    })
    @PutMapping("/mfa")
    public ResponseEntity<AccountProfileResponse> updateMfaPreference(@Valid @RequestBody UpdateMfaPreferenceRequest request) {
        return ResponseEntity.ok(authService.updateMfaPreference(SecurityUtils.getCurrentAccountId(), request));
    }

    @Operation(summary = "Request a password reset link", description = "Always answers with the same message.")
    @PostMapping("/password/forgot")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        return ResponseEntity.ok(authService.forgotPassword(request));
    }

    @Operation(summary = "Reset the password with an emailed token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password reset"),
            @ApiResponse(responseCode = "400", description = "Token unknown or expired"),
            @ApiResponse(responseCode = "422", description = "Password policy failed")
    })
    @PostMapping("/password/reset")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        return ResponseEntity.ok(authService.resetPassword(request));
    }

    @Operation(summary = "Start a password change", description = "Emails a code that confirms the change.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Code sent"),
            @ApiResponse(responseCode = "400", description = "Current password incorrect"),
            @ApiResponse(responseCode = "401", description = "Not logged in"),
            @ApiResponse(responseCode = "422", description = "Password policy failed or password unchanged")
    })
    @PostMapping("/password/change")
    public ResponseEntity<MessageResponse> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        return ResponseEntity.ok(authService.changePassword(SecurityUtils.getCurrentAccountId(), request));
    }

    @Operation(summary = "Confirm a password change with the emailed code")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password changed"),
            @ApiResponse(responseCode = "400", description = "Code invalid, expired or never issued"),
            @ApiResponse(responseCode = "401", description = "Not logged in")
    })
    @PostMapping("/password/change/verify")
    public ResponseEntity<MessageResponse> verifyChangePassword(@Valid @RequestBody VerifyChangePasswordRequest request) {
        return ResponseEntity.ok(authService.verifyChangePassword(SecurityUtils.getCurrentAccountId(), request));
    }

    @Operation(summary = "Issue a remember-me token for this device")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Token issued"),
            @ApiResponse(responseCode = "401", description = "Not logged in")
    })
    @PostMapping("/remember-me")
    public ResponseEntity<RememberMeTokenResponse> createRememberMeToken() {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(authService.createRememberMeToken(SecurityUtils.getCurrentAccountId()));
    }

    @Operation(summary = "Log in with a remember-me token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Authenticated"),
            @ApiResponse(responseCode = "400", description = "Token unknown or expired")
    })
    @PostMapping("/remember-me/login")
    public ResponseEntity<LoginResponse> redeemRememberMeToken(@Valid @RequestBody RememberMeLoginRequest request) {
        return ResponseEntity.ok(authService.redeemRememberMeToken(request));
    }

    @Operation(summary = "Log out", description = "Revokes the presented session token and every remember-me token of the account.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Logged out"),
            @ApiResponse(responseCode = "401", description = "Not logged in")
    })
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout() {
        return ResponseEntity.ok(authService.logout(SecurityUtils.getCurrentToken()));
    }

    private static String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (StringUtils.hasText(forwarded)) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
