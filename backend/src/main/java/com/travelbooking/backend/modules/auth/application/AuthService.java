package com.travelbooking.backend.modules.auth.application;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.travelbooking.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.travelbooking.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.travelbooking.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.travelbooking.backend.modules.auth.domain.Account;
import com.travelbooking.backend.modules.auth.domain.ExpiringSecret;
import com.travelbooking.backend.modules.auth.domain.MfaPurpose;
import com.travelbooking.backend.modules.auth.domain.PasswordPolicy;
import com.travelbooking.backend.modules.auth.domain.PasswordPolicyResult;
import com.travelbooking.backend.modules.auth.domain.RememberMeToken;
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
import com.travelbooking.backend.modules.notification.application.AuthNotificationService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Account lifecycle: signup and email verification, password login with lockout, MFA step-up,
 * password reset and change, remember-me tokens and logout.
 *
 * <p>Domain errors are committed, not rolled back, so that counter and token updates made before
 * the rejection (failed attempts, cleared codes, deleted tokens) stick.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    public static final Duration EMAIL_VERIFICATION_VALIDITY = Duration.ofHours(24);
    public static final Duration PASSWORD_RESET_VALIDITY = Duration.ofMinutes(60);
    public static final Duration MFA_CODE_VALIDITY = Duration.ofMinutes(10);
    public static final Duration REMEMBER_ME_VALIDITY = Duration.ofDays(30);
    public static final Duration LOCKOUT_DURATION = Duration.ofMinutes(30);
    public static final int MAX_FAILED_LOGIN_ATTEMPTS = 5;

    public static final String SIGNUP_MESSAGE =
            "Account created successfully. Please check your email to verify your account.";
    public static final String FORGOT_PASSWORD_MESSAGE =
            "If an account with that email exists, a password reset link has been sent.";
    static final String INVALID_CREDENTIALS_MESSAGE = "Incorrect email or password.";

    private final AccountStore accountStore;
    private final PasswordPolicy passwordPolicy;
    private final SecretGenerator secretGenerator;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final RevocationRegistry revocationRegistry;
    private final AuthNotificationService notificationService;
    private final boolean enumerationSafeLogin;
    private final String unknownAccountHash;

    public AuthService(
            AccountStore accountStore,
            PasswordPolicy passwordPolicy,
            SecretGenerator secretGenerator,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            RevocationRegistry revocationRegistry,
            AuthNotificationService notificationService,
            @Value("${app.auth.enumeration-safe-login:false}") boolean enumerationSafeLogin
    ) {
        this.accountStore = accountStore;
        this.passwordPolicy = passwordPolicy;
        this.secretGenerator = secretGenerator;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.revocationRegistry = revocationRegistry;
        this.notificationService = notificationService;
        this.enumerationSafeLogin = enumerationSafeLogin;
        this.unknownAccountHash = passwordEncoder.encode(secretGenerator.standardToken());
    }

    // A unique-key violation marks the transaction rollback-only, so a conflict here must roll back.
    @Transactional
    public MessageResponse signup(SignupRequest request) {
        String email = normalizeEmail(request.email());
        if (accountStore.existsByEmail(email)) {
            throw AuthException.conflict("EMAIL_ALREADY_REGISTERED", "An account with this email already exists");
        }
        validateNewPassword(request.password(), email);

        Account account;
        try {
            account = Account.register(email, request.firstName(), request.lastName(),
                    passwordEncoder.encode(request.password()), request.organiser());
        } catch (IllegalArgumentException ex) {
            throw AuthException.validation("INVALID_ACCOUNT_DETAILS", ex.getMessage());
        }

        String token = secretGenerator.standardToken();
        account.issueEmailVerification(newSecret(token, EMAIL_VERIFICATION_VALIDITY));
        Account saved = accountStore.create(account);
        log.info("Account {} registered role={}", saved.getId(), saved.getRole());

        notificationService.sendEmailVerification(saved, token, EMAIL_VERIFICATION_VALIDITY);
        return new MessageResponse(SIGNUP_MESSAGE);
    }

    public MessageResponse verifyEmail(VerifyEmailRequest request) {
        OffsetDateTime now = secretGenerator.now();
        String tokenHash = secretGenerator.digest(request.token());
        Account account = accountStore.findByVerificationTokenHash(tokenHash)
                .orElseThrow(AuthService::invalidVerificationToken);
        ExpiringSecret secret = account.getEmailVerification()
                .orElseThrow(AuthService::invalidVerificationToken);
        if (secret.isExpired(now) || !secret.matches(tokenHash, now)) {
            throw invalidVerificationToken();
        }

        account.markEmailVerified();
        accountStore.save(account);
        log.info("Account {} verified its email", account.getId());
        return new MessageResponse("Email verified successfully. You can now log in.");
    }

    public MessageResponse resendVerification(ResendVerificationRequest request) {
        String email = normalizeEmail(request.email());
        Account account = accountStore.findByEmail(email)
                .orElseThrow(() -> accountNotFound(email));
        if (account.isEmailVerified()) {
            throw AuthException.conflict("EMAIL_ALREADY_VERIFIED", "Email is already verified");
        }

        String token = secretGenerator.standardToken();
        account.issueEmailVerification(newSecret(token, EMAIL_VERIFICATION_VALIDITY));
        accountStore.save(account);

        notificationService.sendEmailVerification(account, token, EMAIL_VERIFICATION_VALIDITY);
        return new MessageResponse("Verification email sent. Please check your inbox.");
    }

    public LoginResponse login(LoginRequest request) {
        return login(request, null);
    }

    public LoginResponse login(LoginRequest request, String clientIp) {
        OffsetDateTime now = secretGenerator.now();
        String email = normalizeEmail(request.email());
        Optional<Account> found = accountStore.findByEmail(email);
        if (found.isEmpty()) {
            log.warn("Login attempt for unknown email");
            if (enumerationSafeLogin) {
                // same hashing cost as a wrong password
                passwordEncoder.matches(request.password(), unknownAccountHash);
                throw invalidCredentials();
            }
            throw accountNotFound(email);
        }
        Account account = found.get();

        if (!account.isEmailVerified()) {
            throw AuthException.unverified("Please verify your email address before logging in.");
        }
        if (account.isLocked(now)) {
            long minutes = account.minutesUntilUnlock(now);
            throw new AccountLockedException("ACCOUNT_LOCKED",
                    "Account is locked due to too many failed login attempts. Try again in " + minutes + " minutes.",
                    minutes);
        }
        if (account.hasLapsedLock(now)) {
            account.clearLockout();
            account = accountStore.save(account);
        }

        if (!passwordEncoder.matches(request.password(), account.getPasswordHash())) {
            OffsetDateTime lockUntil = now.plus(LOCKOUT_DURATION);
            int attempts = accountStore.recordFailedLogin(account.getId(), MAX_FAILED_LOGIN_ATTEMPTS, lockUntil);
            if (attempts >= MAX_FAILED_LOGIN_ATTEMPTS) {
                log.warn("Account {} locked after {} failed login attempts", account.getId(), attempts);
                notificationService.sendLockoutAlert(account, attempts, lockUntil, clientIp);
                throw new AccountLockedException("TOO_MANY_ATTEMPTS",
                        "Too many failed login attempts. Account locked for " + LOCKOUT_DURATION.toMinutes() + " minutes.",
                        LOCKOUT_DURATION.toMinutes());
            }
            log.info("Failed login for account {} attempt={}", account.getId(), attempts);
            throw enumerationSafeLogin
                    ? invalidCredentials()
                    : AuthException.notFoundOrExpired("INCORRECT_PASSWORD", "Incorrect password.");
        }

        boolean dirty = false;
        if (account.getFailedLoginAttempts() > 0 || account.getLockedUntil().isPresent()) {
            account.clearLockout();
            dirty = true;
        }

        if (account.isMfaEnabled()) {
            String code = secretGenerator.numericCode();
            account.issueMfaCode(newSecret(code, MFA_CODE_VALIDITY), MfaPurpose.LOGIN, null);
            accountStore.save(account);
            log.info("Account {} passed password check, MFA pending", account.getId());
            notificationService.sendMfaCode(account, code, MFA_CODE_VALIDITY);
            return LoginResponse.mfaPending(account.getId(), account.getEmail());
        }

        if (dirty) {
            account = accountStore.save(account);
        }
        log.info("Account {} logged in role={}", account.getId(), account.getRole());
        return authenticated(account);
    }

    public LoginResponse verifyMfa(VerifyMfaRequest request) {
        OffsetDateTime now = secretGenerator.now();
        Account account = accountStore.findById(request.accountId())
                .orElseThrow(AuthService::mfaNotInitiated);
        ExpiringSecret code = account.getMfaCode()
                .filter(secret -> account.getMfaPurpose().orElse(null) == MfaPurpose.LOGIN)
                .orElseThrow(AuthService::mfaNotInitiated);

        if (code.isExpired(now)) {
            account.clearMfaCode();
            accountStore.save(account);
            throw AuthException.notFoundOrExpired("MFA_CODE_EXPIRED", "MFA code has expired. Please login again.");
        }
        if (!code.matches(secretGenerator.digest(request.code()), now)) {
            log.info("Invalid MFA code for account {}", account.getId());
            throw AuthException.notFoundOrExpired("MFA_CODE_INVALID", "Invalid MFA code.");
        }

        account.clearMfaCode();
        Account saved = accountStore.save(account);
        log.info("Account {} completed MFA login", saved.getId());
        return authenticated(saved);
    }

    public MessageResponse forgotPassword(ForgotPasswordRequest request) {
        String email = normalizeEmail(request.email());
        accountStore.findByEmail(email).ifPresentOrElse(account -> {
            String token = secretGenerator.standardToken();
            account.issuePasswordReset(newSecret(token, PASSWORD_RESET_VALIDITY));
            accountStore.save(account);
            log.info("Password reset requested for account {}", account.getId());
            notificationService.sendPasswordReset(account, token, PASSWORD_RESET_VALIDITY);
        }, () -> log.info("Password reset requested for unknown email"));
        return new MessageResponse(FORGOT_PASSWORD_MESSAGE);
    }

    public MessageResponse resetPassword(ResetPasswordRequest request) {
        OffsetDateTime now = secretGenerator.now();
        String tokenHash = secretGenerator.digest(request.token());
        Account account = accountStore.findByResetTokenHash(tokenHash)
                .orElseThrow(AuthService::invalidResetToken);
        ExpiringSecret secret = account.getPasswordReset()
                .orElseThrow(AuthService::invalidResetToken);
        if (secret.isExpired(now) || !secret.matches(tokenHash, now)) {
            throw invalidResetToken();
        }

        validateNewPassword(request.newPassword(), account.getEmail());
        account.applyPasswordHash(passwordEncoder.encode(request.newPassword()));
        accountStore.save(account);
        log.info("Account {} reset its password", account.getId());
        return new MessageResponse("Password has been reset successfully. You can now log in with your new password.");
    }

    public MessageResponse changePassword(Long accountId, ChangePasswordRequest request) {
        Account account = requireAccount(accountId);
        if (!passwordEncoder.matches(request.currentPassword(), account.getPasswordHash())) {
            throw AuthException.notFoundOrExpired("INCORRECT_PASSWORD", "Current password is incorrect.");
        }
        validateNewPassword(request.newPassword(), account.getEmail());
        if (passwordEncoder.matches(request.newPassword(), account.getPasswordHash())) {
            throw AuthException.validation("PASSWORD_UNCHANGED", "New password must be different from the current password.");
        }

        String code = secretGenerator.numericCode();
        account.issueMfaCode(newSecret(code, MFA_CODE_VALIDITY), MfaPurpose.PASSWORD_CHANGE,
                passwordEncoder.encode(request.newPassword()));
        accountStore.save(account);
        log.info("Account {} requested a password change, verification pending", account.getId());

        notificationService.sendPasswordChangeCode(account, code, MFA_CODE_VALIDITY);
        return new MessageResponse("A verification code has been sent to your email. Enter it to complete the password change.");
    }

    public MessageResponse verifyChangePassword(Long accountId, VerifyChangePasswordRequest request) {
        OffsetDateTime now = secretGenerator.now();
        Account account = requireAccount(accountId);
        ExpiringSecret code = account.getMfaCode()
                .filter(secret -> account.getMfaPurpose().orElse(null) == MfaPurpose.PASSWORD_CHANGE)
                .filter(secret -> account.getPendingPasswordHash().isPresent())
                .orElseThrow(() -> AuthException.notFoundOrExpired("PASSWORD_CHANGE_NOT_INITIATED",
                        "No pending password change. Please start the password change again."));

        if (code.isExpired(now)) {
            account.clearMfaCode();
            accountStore.save(account);
            throw AuthException.notFoundOrExpired("MFA_CODE_EXPIRED", "Verification code has expired. Please start the password change again.");
        }
        if (!code.matches(secretGenerator.digest(request.code()), now)) {
            throw AuthException.notFoundOrExpired("MFA_CODE_INVALID", "Invalid verification code.");
        }

        String pendingHash = account.getPendingPasswordHash().orElseThrow();
        account.applyPasswordHash(pendingHash);
        accountStore.save(account);
        log.info("Account {} changed its password", account.getId());
        return new MessageResponse("Password changed successfully.");
    }

    public RememberMeTokenResponse createRememberMeToken(Long accountId) {
        Account account = requireAccount(accountId);
        OffsetDateTime now = secretGenerator.now();
        String token = secretGenerator.rememberMeToken();
        OffsetDateTime expiresAt = now.plus(REMEMBER_ME_VALIDITY);

        accountStore.saveRememberMeToken(new RememberMeToken(account, secretGenerator.digest(token), expiresAt, now));
        log.info("Account {} issued a remember-me token", account.getId());
        return new RememberMeTokenResponse(token, expiresAt);
    }

    public LoginResponse redeemRememberMeToken(RememberMeLoginRequest request) {
        OffsetDateTime now = secretGenerator.now();
        RememberMeToken stored = accountStore.findRememberMeToken(secretGenerator.digest(request.token()))
                .orElseThrow(() -> AuthException.notFoundOrExpired("INVALID_REMEMBER_ME_TOKEN", "Invalid remember me token."));
        if (stored.isExpired(now)) {
            accountStore.deleteRememberMeToken(stored);
            throw AuthException.notFoundOrExpired("REMEMBER_ME_TOKEN_EXPIRED", "Remember me token has expired. Please log in again.");
        }

        Account account = stored.getAccount();
        log.info("Account {} logged in with a remember-me token", account.getId());
        return authenticated(account);
    }

    public MessageResponse logout(String sessionToken) {
        ParsedToken parsed;
        try {
            parsed = jwtTokenService.parse(sessionToken);
        } catch (InvalidTokenException ex) {
            throw AuthException.unauthenticated("Invalid or expired session token");
        }

        revocationRegistry.revoke(sessionToken, parsed.expiresAt().toInstant());
        int removed = accountStore.deleteRememberMeTokens(parsed.accountId());
        log.info("Account {} logged out, {} remember-me tokens removed", parsed.accountId(), removed);
        return new MessageResponse("Logged out successfully");
    }

    public AccountProfileResponse updateMfaPreference(Long accountId, UpdateMfaPreferenceRequest request) {
        Account account = requireAccount(accountId);
        if (!passwordEncoder.matches(request.currentPassword(), account.getPasswordHash())) {
            throw AuthException.notFoundOrExpired("INCORRECT_PASSWORD", "Current password is incorrect.");
        }
        boolean enabled = Boolean.TRUE.equals(request.enabled());
        account.changeMfaEnabled(enabled);
        if (!enabled && account.getMfaPurpose().orElse(null) == MfaPurpose.LOGIN) {
            account.clearMfaCode();
        }
        Account saved = accountStore.save(account);
        log.info("Account {} set MFA enabled={}", saved.getId(), enabled);
        return toProfile(saved);
    }

    @Transactional(readOnly = true)
    public AccountProfileResponse loadProfile(Long accountId) {
        return toProfile(requireAccount(accountId));
    }

    private LoginResponse authenticated(Account account) {
        IssuedToken issued = jwtTokenService.issue(account);
        return LoginResponse.authenticated(
                issued.token(),
                issued.expiresAt(),
                account.getId(),
                account.getEmail(),
                account.getFirstName(),
                account.getLastName(),
                account.getRole()
        );
    }

    private AccountProfileResponse toProfile(Account account) {
        return new AccountProfileResponse(
                account.getId(),
                account.getEmail(),
                account.getFirstName(),
                account.getLastName(),
                account.getRole(),
                account.isOrganiser(),
                account.isEmailVerified(),
                account.isMfaEnabled(),
                account.getCreatedAt(),
                account.getUpdatedAt()
        );
    }

    private void validateNewPassword(String password, String email) {
        PasswordPolicyResult result = passwordPolicy.evaluate(password);
        if (!result.accepted()) {
            throw AuthException.validation("PASSWORD_POLICY_VIOLATION", result.joinedViolations());
        }
        if (passwordPolicy.containsIdentifier(password, email)) {
            throw AuthException.validation("PASSWORD_CONTAINS_EMAIL", "Password must not contain your email address");
        }
    }

    private ExpiringSecret newSecret(String rawValue, Duration validFor) {
        return ExpiringSecret.of(secretGenerator.digest(rawValue), secretGenerator.expiryAt(validFor));
    }

    private Account requireAccount(Long accountId) {
        return accountStore.findById(accountId)
                .orElseThrow(() -> AuthException.unauthenticated("Account no longer exists"));
    }

    private static String normalizeEmail(String email) {
        return email == null ? "" : email.trim();
    }

    private static AuthException accountNotFound(String email) {
        return AuthException.notFoundOrExpired("ACCOUNT_NOT_FOUND", "User with email: " + email + " does not exist.");
    }

    private static AuthException invalidCredentials() {
        return AuthException.notFoundOrExpired("INVALID_CREDENTIALS", INVALID_CREDENTIALS_MESSAGE);
    }

    private static AuthException invalidVerificationToken() {
        return AuthException.notFoundOrExpired("INVALID_VERIFICATION_TOKEN", "Invalid or expired verification token");
    }

    private static AuthException invalidResetToken() {
        return AuthException.notFoundOrExpired("INVALID_RESET_TOKEN", "Invalid or expired password reset token");
    }

    private static AuthException mfaNotInitiated() {
        return AuthException.notFoundOrExpired("MFA_NOT_INITIATED", "No MFA code found. Please initiate login again.");
    }
}
